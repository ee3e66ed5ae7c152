package com.hydra.backend.service.execution;

public record ExecutionResult(
        boolean filled,
        String orderId,
        double fillPrice,
        String message
) {

    public static ExecutionResult filled(String orderId, double fillPrice) {
        return new ExecutionResult(true, orderId, fillPrice, "filled");
    }

    public static ExecutionResult rejected(String message) {
        return new ExecutionResult(false, null, 0.0, message);
    }
}
