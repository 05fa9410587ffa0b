package io.dagtest.core.node;

/// Body that produces sub-tests instead of running assertions itself.
///
/// Every emitted sub-test becomes a separate sub-invocation of the node,
/// counted by the node's {@link io.dagtest.core.policy.ResultPolicy}. If the
/// generator itself throws, the throwable is recorded as one more
/// sub-invocation named after the node.
///
/// ### Example
/// {@snippet :
/// TestGenerator squares = (emitter, context) -> {
///     for (int i = 0; i < 5; i++) {
///         emitter.emit(SubTest.of("square", ctx -> check((int) ctx.getArgs().get(0)), i));
///     }
/// };
/// }
@FunctionalInterface
public interface TestGenerator {

    /// Emits sub-tests.
    ///
    /// @param emitter receiver for sub-tests, never null
    /// @param context per-execution context of the node, never null
    /// @throws Exception anything the generator raises
    void generate(SubTestEmitter emitter, TestContext context) throws Exception;
}
