package fr.imt.distroforge.distroforge.business.stage;

import java.util.List;

public record StageResult(boolean ok, List<String> logLines, String failureReason) {

    public StageResult {
        logLines = logLines != null ? List.copyOf(logLines) : List.of();
    }

    public static StageResult success(String... logLines) {
        return new StageResult(true, List.of(logLines), null);
    }

    public static StageResult success(List<String> logLines) {
        return new StageResult(true, logLines, null);
    }

    public static StageResult failure(String reason) {
        return new StageResult(false, List.of(), reason);
    }
}
