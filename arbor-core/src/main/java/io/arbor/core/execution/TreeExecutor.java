package io.arbor.core.execution;

import io.arbor.core.ArborConfig;
import io.arbor.core.event.Event;
import io.arbor.core.reactive.ReactiveNode;
import io.arbor.core.tree.Node;
import io.arbor.core.tree.Status;
import java.util.Objects;
import java.util.logging.Logger;

/// Drives a behavior tree from its root until it produces a verdict.
///
/// ### Poll model
/// {@link #execute(Node, Object)} steps the root repeatedly with the context until it
/// returns a terminal status. The loop never yields; it is only appropriate when steps
/// make bounded progress, or when {@link ArborConfig#getMaxTicks()} bounds the run.
///
/// ### Reactive model
/// {@link #execute(ReactiveNode, Iterable, Object)} consumes events one at a time. An
/// event whose kind the root is not interested in ends the run without a verdict (or is
/// skipped, see {@link ArborConfig#isStopOnUninterestedRoot()}). A terminal status ends
/// the run; an exhausted source leaves it {@link ExecutionResult.Pending}.
///
/// ### Contracts
/// - **Postcondition**: when {@link ArborConfig#isResetOnCompletion()} is set, a root that
///   produced a terminal status has been reset and can be executed again
/// - **Postcondition**: a pending run leaves the tree's resumption state untouched
///
/// Exceptions thrown by user leaves propagate unchanged.
///
/// @implNote **Not thread-safe**. The executor holds no per-run state, but the trees it
/// drives do; a tree must not be executed concurrently.
///
/// @see TreeListener for observability
public class TreeExecutor {

    private static final Logger logger = Logger.getLogger(TreeExecutor.class.getName());

    private final ArborConfig config;
    private final TreeListener listener;

    /// Creates an executor with default configuration and no listener.
    public TreeExecutor() {
        this(new ArborConfig(), TreeListener.NOOP);
    }

    /// @param config execution options, not null
    public TreeExecutor(ArborConfig config) {
        this(config, TreeListener.NOOP);
    }

    /// @param config execution options, not null
    /// @param listener lifecycle listener, not null
    public TreeExecutor(ArborConfig config, TreeListener listener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /// Steps `root` until it finishes or the tick limit is reached.
    ///
    /// @param root tree root, not null
    /// @param context shared context passed to every step
    /// @return the run outcome, never null
    public <C> ExecutionResult execute(Node<C> root, C context) {
        Objects.requireNonNull(root, "root must not be null");
        logger.fine(() -> "Starting poll run of " + root.getClass().getSimpleName());
        listener.onStart();

        long ticks = 0;
        while (true) {
            Status status = root.step(context);
            ticks++;
            listener.onTick(ticks, status);

            if (status.isTerminal()) {
                return complete(root::reset, status, ticks);
            }
            if (config.getMaxTicks() > 0 && ticks >= config.getMaxTicks()) {
                logger.warning("Tree still running after tick limit of " + ticks + " ticks");
                return pending(ticks);
            }
        }
    }

    /// Steps `root` to completion and reports whether it succeeded.
    ///
    /// @param root tree root, not null
    /// @param context shared context passed to every step
    /// @return `true` on {@link Status#SUCCESS}, `false` on {@link Status#FAILURE}
    /// @throws IllegalStateException if the tick limit left the tree running
    public <C> boolean run(Node<C> root, C context) {
        ExecutionResult result = execute(root, context);
        if (result.isPending()) {
            throw new IllegalStateException(
                    "Tree did not finish within " + result.ticks() + " ticks");
        }
        return result.isSuccess();
    }

    /// Feeds `events` to `root` one at a time until it finishes or the source ends.
    ///
    /// @param root tree root, not null
    /// @param events event source, consumed lazily, not null
    /// @param context shared context passed to every react call
    /// @return the run outcome, {@link ExecutionResult.Pending} without a verdict
    public <C> ExecutionResult execute(
            ReactiveNode<C> root, Iterable<? extends Event> events, C context) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(events, "events must not be null");
        logger.fine(() -> "Starting reactive run of " + root.getClass().getSimpleName());
        listener.onStart();

        long ticks = 0;
        for (Event event : events) {
            if (!root.isInterestedIn(event.kind())) {
                listener.onEventIgnored(event);
                if (config.isStopOnUninterestedRoot()) {
                    logger.fine(() -> "Root not interested in " + event.eventName() + ", stopping");
                    break;
                }
                continue;
            }

            Status status = root.react(event, context);
            ticks++;
            listener.onEvent(ticks, event, status);

            if (status.isTerminal()) {
                return complete(root::reset, status, ticks);
            }
        }

        return pending(ticks);
    }

    private ExecutionResult complete(Resettable root, Status status, long ticks) {
        if (config.isResetOnCompletion()) {
            root.reset(status);
        }
        ExecutionResult result = ExecutionResult.of(status, ticks);
        logger.fine(() -> "Tree finished with " + status + " after " + ticks + " ticks");
        listener.onFinish(result);
        return result;
    }

    private ExecutionResult pending(long ticks) {
        ExecutionResult result = new ExecutionResult.Pending(ticks);
        listener.onFinish(result);
        return result;
    }

    @FunctionalInterface
    private interface Resettable {
        void reset(Status lastStatus);
    }
}
