package canopy.core.service.fallback;

import java.util.ArrayList;
import java.util.List;

import canopy.core.model.estimate.AttemptRecord;

/**
 * Collects the attempt records of one request.
 *
 * <p>Once sealed, further records are dropped: attempts abandoned by the race
 * may still report after the request has been answered.
 */
final class AttemptLog {

    private final List<AttemptRecord> records = new ArrayList<>();
    private boolean sealed;

    synchronized boolean record(AttemptRecord attempt) {
        if (sealed) {
            return false;
        }
        records.add(attempt);
        return true;
    }

    synchronized List<AttemptRecord> seal() {
        sealed = true;
        return List.copyOf(records);
    }
}
