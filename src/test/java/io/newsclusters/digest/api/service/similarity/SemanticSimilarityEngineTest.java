package io.newsclusters.digest.api.service.similarity;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SemanticSimilarityEngineTest {

    @Mock
    private EmbeddingModel embeddingModel;

    @Test
    @DisplayName("Should compute cosine similarity of embeddings")
    void shouldComputeCosineSimilarityOfEmbeddings() {
        when(embeddingModel.embedAll(anyList())).thenReturn(Response.from(List.of(
                Embedding.from(new float[]{1f, 0f}),
                Embedding.from(new float[]{1f, 1f}),
                Embedding.from(new float[]{0f, 1f})
        )));

        SimilarityMatrix matrix = new SemanticSimilarityEngine(embeddingModel)
                .similarity(List.of("Regen morgen erwartet", "Rain expected tomorrow", "Stock market rallies"));

        assertThat(matrix.get(0, 1)).isCloseTo(Math.sqrt(0.5), within(1e-6));
        assertThat(matrix.get(0, 2)).isCloseTo(0.0, within(1e-9));
        assertThat(matrix.get(1, 1)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should clamp negative cosine to zero")
    void shouldClampNegativeCosineToZero() {
        when(embeddingModel.embedAll(anyList())).thenReturn(Response.from(List.of(
                Embedding.from(new float[]{1f, 0f}),
                Embedding.from(new float[]{-1f, 0f})
        )));

        SimilarityMatrix matrix = new SemanticSimilarityEngine(embeddingModel).similarity(List.of("up", "down"));

        assertThat(matrix.get(0, 1)).isZero();
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Should skip blank titles when embedding")
    void shouldSkipBlankTitlesWhenEmbedding() {
        when(embeddingModel.embedAll(anyList())).thenReturn(Response.from(List.of(
                Embedding.from(new float[]{1f, 0f}),
                Embedding.from(new float[]{1f, 0f})
        )));

        SimilarityMatrix matrix = new SemanticSimilarityEngine(embeddingModel).similarity(List.of("one", " ", "two"));

        ArgumentCaptor<List<TextSegment>> captor = ArgumentCaptor.forClass(List.class);
        verify(embeddingModel).embedAll(captor.capture());
        assertThat(captor.getValue()).extracting(TextSegment::text).containsExactly("one", "two");

        assertThat(matrix.get(0, 2)).isCloseTo(1.0, within(1e-9));
        assertThat(matrix.get(0, 1)).isZero();
        assertThat(matrix.get(1, 1)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should not call the encoder for an empty title list")
    void shouldNotCallEncoderForEmptyTitles() {
        SimilarityMatrix matrix = new SemanticSimilarityEngine(embeddingModel).similarity(List.of());

        assertThat(matrix.isEmpty()).isTrue();
        verifyNoInteractions(embeddingModel);
    }
}
