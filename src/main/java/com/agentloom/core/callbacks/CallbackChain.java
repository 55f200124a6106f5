package com.agentloom.core.callbacks;

import java.util.List;
import java.util.Optional;

/**
 * Runs an ordered list of callbacks until one of them makes a decision.
 */
public final class CallbackChain {

    private CallbackChain() {}

    /**
     * Adapts one callback type to the chain.
     */
    @FunctionalInterface
    public interface Invoker<C, R> {
        Optional<R> invoke(C callback) throws Exception;
    }

    /**
     * Invokes the callbacks in registration order and returns the first non-empty result.
     * Later callbacks are not invoked once a decision was made. Unchecked failures propagate
     * unchanged, checked ones are wrapped in {@link CallbackExecutionException}.
     *
     * @param phase name used in failure messages, e.g. "before_model"
     */
    public static <C, R> Optional<R> firstDecision(String phase, List<C> callbacks, Invoker<C, R> invoker) {
        for (C callback : callbacks) {
            Optional<R> result;
            try {
                result = invoker.invoke(callback);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CallbackExecutionException(phase, e);
            }
            if (result != null && result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }
}
