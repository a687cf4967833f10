package fr.tictak.pulse.dto.out;

import java.util.List;

public record SyncResult(String sourceId, boolean success, int collected, List<String> errors) {

    public static SyncResult failed(String sourceId, String error) {
        return new SyncResult(sourceId, false, 0, List.of(error));
    }
}
