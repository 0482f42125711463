package me.golemcore.codeshell.adapter.outbound.model;

import me.golemcore.codeshell.domain.model.ModelChunk;
import me.golemcore.codeshell.domain.model.ModelRequest;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;

class NoOpModelAdapterTest {

    private final NoOpModelAdapter adapter = new NoOpModelAdapter();

    @Test
    void shouldAnswerWithPlaceholderAndEndTurn() {
        ModelRequest request = ModelRequest.builder().runId("run-1").transcript(List.of()).tools(List.of()).build();

        StepVerifier.create(adapter.completeStream(request))
                .expectNextMatches(chunk -> chunk.getType() == ModelChunk.Type.TEXT_DELTA
                        && NoOpModelAdapter.PLACEHOLDER.equals(chunk.getText()))
                .expectNextMatches(chunk -> chunk.getType() == ModelChunk.Type.END_OF_TURN)
                .verifyComplete();
    }

    @Test
    void shouldReportUnavailable() {
        assertFalse(adapter.isAvailable());
    }
}
