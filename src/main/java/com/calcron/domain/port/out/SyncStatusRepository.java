package com.calcron.domain.port.out;

import com.calcron.domain.model.SyncReport;
import java.util.Optional;

public interface SyncStatusRepository {

    void recordLastCycle(SyncReport report);

    Optional<SyncReport> getLastCycle();
}
