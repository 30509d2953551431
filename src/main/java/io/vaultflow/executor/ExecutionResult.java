package io.vaultflow.executor;

public record ExecutionResult(
        Outcome outcome,
        String output,
        String error
) {
    public enum Outcome {
        SUCCESS("success"),
        MANUAL_REQUIRED("manual_required"),
        FAILED("error");

        private final String code;

        Outcome(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    public static ExecutionResult ok(String output) {
        return new ExecutionResult(Outcome.SUCCESS, output, null);
    }

    public static ExecutionResult manual(String instructions) {
        return new ExecutionResult(Outcome.MANUAL_REQUIRED, instructions, null);
    }

    public static ExecutionResult fail(String error) {
        return new ExecutionResult(Outcome.FAILED, null, error);
    }

    public boolean failed() {
        return outcome == Outcome.FAILED;
    }
}
