package fr.lapetina.possibility.pool;

import fr.lapetina.possibility.domain.event.StreamEvent;
import fr.lapetina.possibility.domain.event.StreamEventParser;
import fr.lapetina.possibility.domain.model.ChatMessage;
import fr.lapetina.possibility.domain.model.ErrorType;
import fr.lapetina.possibility.domain.model.PossibilityMetadata;
import fr.lapetina.possibility.infrastructure.http.GenerationEndpoint;
import fr.lapetina.possibility.infrastructure.http.GenerationException;
import fr.lapetina.possibility.infrastructure.http.GenerationStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Streams one possibility from the generation endpoint.
 *
 * Runs on a worker thread and never touches pool state: every observation is
 * reported back to the pool loop as a command carrying this dispatch's handle.
 * Exactly one of COMPLETED, FAILED or ABORTED is reported per run.
 */
final class PossibilityStreamTask implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PossibilityStreamTask.class);

    private final PossibilityMetadata metadata;
    private final List<ChatMessage> conversation;
    private final CancellationHandle handle;
    private final GenerationEndpoint endpoint;
    private final StreamEventParser parser;
    private final Consumer<Consumer<PoolCommand>> reporter;

    PossibilityStreamTask(
            PossibilityMetadata metadata,
            List<ChatMessage> conversation,
            CancellationHandle handle,
            GenerationEndpoint endpoint,
            StreamEventParser parser,
            Consumer<Consumer<PoolCommand>> reporter
    ) {
        this.metadata = metadata;
        this.conversation = conversation;
        this.handle = handle;
        this.endpoint = endpoint;
        this.parser = parser;
        this.reporter = reporter;
    }

    @Override
    public void run() {
        String id = metadata.id();
        if (handle.isCancelled()) {
            reportAborted();
            return;
        }

        try {
            CompletableFuture<GenerationStream> pending = endpoint.open(metadata, conversation);
            handle.bind(() -> pending.cancel(true));

            GenerationStream stream = pending.get();
            if (stream == null) {
                throw new GenerationException(ErrorType.STREAM_ERROR, "No response body");
            }
            handle.bind(stream);
            if (handle.isCancelled()) {
                reportAborted();
                return;
            }

            report(c -> c.initialize(PoolCommandType.STREAM_OPENED, id).handle(handle));
            readEvents(stream);

            if (handle.isCancelled()) {
                reportAborted();
                return;
            }
            report(c -> c.initialize(PoolCommandType.COMPLETED, id).handle(handle));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reportAborted();
        } catch (CancellationException e) {
            reportAborted();
        } catch (ExecutionException | IOException | RuntimeException e) {
            if (handle.isCancelled()) {
                reportAborted();
            } else {
                reportFailure(e);
            }
        } finally {
            handle.release();
        }
    }

    private void readEvents(GenerationStream stream) throws IOException {
        String line;
        while ((line = stream.readLine()) != null) {
            if (handle.isCancelled()) {
                return;
            }
            Optional<StreamEvent> parsed = parser.parse(line);
            if (parsed.isEmpty()) {
                continue;
            }

            StreamEvent event = parsed.get();
            if (event instanceof StreamEvent.Token token) {
                report(c -> c.initialize(PoolCommandType.TOKEN, metadata.id())
                        .handle(handle)
                        .token(token.token()));
            } else if (event instanceof StreamEvent.Probability probability) {
                report(c -> c.initialize(PoolCommandType.PROBABILITY, metadata.id())
                        .handle(handle)
                        .probability(probability.probability(), probability.logprobs()));
            } else if (event instanceof StreamEvent.Error error) {
                throw new GenerationException(ErrorType.PROVIDER_ERROR, error.message());
            } else if (event.isTerminal()) {
                return;
            }
        }
    }

    private void reportFailure(Throwable ex) {
        Throwable cause = GenerationException.unwrap(ex);
        ErrorType errorType = GenerationException.classify(cause);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();

        if (errorType == ErrorType.INTERNAL_ERROR) {
            log.error("Possibility stream failed unexpectedly: possibilityId={}, provider={}, model={}",
                    metadata.id(), metadata.provider(), metadata.model(), cause);
        } else {
            log.warn("Possibility stream failed: possibilityId={}, provider={}, model={}, errorType={}, error={}",
                    metadata.id(), metadata.provider(), metadata.model(), errorType, message);
        }
        report(c -> c.initialize(PoolCommandType.FAILED, metadata.id())
                .handle(handle)
                .error(errorType, message));
    }

    private void reportAborted() {
        log.debug("Possibility stream aborted: possibilityId={}", metadata.id());
        report(c -> c.initialize(PoolCommandType.ABORTED, metadata.id()).handle(handle));
    }

    private void report(Consumer<PoolCommand> filler) {
        reporter.accept(filler);
    }
}
