package fr.lapetina.possibility.domain.metadata;

import fr.lapetina.possibility.domain.model.PossibilityMetadata;
import fr.lapetina.possibility.domain.model.Priority;
import fr.lapetina.possibility.domain.model.SystemInstruction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PossibilityMetadataServiceTest {

    private static final SystemInstruction CONCISE = new SystemInstruction("concise", "Concise", "Be brief.", true);

    private PossibilityMetadataService service;

    @BeforeEach
    void setUp() {
        service = new PossibilityMetadataService();
    }

    private static GenerationSettings settings(List<GenerationSettings.ModelOption> models,
                                               List<Double> temperatures,
                                               List<SystemInstruction> instructions) {
        return new GenerationSettings("Answer in French", models, temperatures, instructions, null);
    }

    @Nested
    @DisplayName("Metadata generation")
    class Generation {

        @Test
        @DisplayName("should generate one possibility per model, temperature and instruction")
        void shouldGenerateCartesianProduct() {
            GenerationSettings settings = settings(
                    List.of(new GenerationSettings.ModelOption("openai", "gpt-4o-mini"),
                            new GenerationSettings.ModelOption("anthropic", "claude-3-5-haiku-20241022")),
                    List.of(0.3, 0.7),
                    List.of(CONCISE));

            List<PossibilityMetadata> metadata = service.generateMetadata(settings);

            assertThat(metadata).hasSize(4);
            assertThat(service.countPossibilities(settings)).isEqualTo(4);
            assertThat(metadata).extracting(PossibilityMetadata::order).containsExactly(0, 1, 2, 3);
            assertThat(metadata).extracting(PossibilityMetadata::id).containsExactly(
                    "openai_gpt-4o-mini_temp0.3_inst-concise",
                    "openai_gpt-4o-mini_temp0.7_inst-concise",
                    "anthropic_claude-3-5-haiku-20241022_temp0.3_inst-concise",
                    "anthropic_claude-3-5-haiku-20241022_temp0.7_inst-concise");
            assertThat(metadata).allSatisfy(m -> {
                assertThat(m.systemPrompt()).isEqualTo("Answer in French");
                assertThat(m.estimatedTokens()).isEqualTo(100);
            });
        }

        @Test
        @DisplayName("should fall back to the default temperature and instruction")
        void shouldUseDefaults() {
            GenerationSettings settings = settings(
                    List.of(new GenerationSettings.ModelOption("mistral", "mistral-large")), List.of(), List.of());

            List<PossibilityMetadata> metadata = service.generateMetadata(settings);

            assertThat(metadata).hasSize(1);
            PossibilityMetadata only = metadata.get(0);
            assertThat(only.temperature()).isEqualTo(0.7);
            assertThat(only.systemInstruction()).isEqualTo(PossibilityMetadataService.DEFAULT_SYSTEM_INSTRUCTION);
            assertThat(only.id()).isEqualTo("mistral_mistral-large_temp0.7_inst-default");
        }

        @Test
        @DisplayName("should use the requested token limit")
        void shouldUseRequestedMaxTokens() {
            GenerationSettings settings = new GenerationSettings(null,
                    List.of(new GenerationSettings.ModelOption("openai", "gpt-4o")), List.of(1.0), List.of(), 512);

            PossibilityMetadata metadata = service.generateMetadata(settings).get(0);

            assertThat(metadata.estimatedTokens()).isEqualTo(512);
            assertThat(metadata.id()).isEqualTo("openai_gpt-4o_temp1_inst-default");
        }

        @Test
        @DisplayName("should generate nothing without enabled models")
        void shouldGenerateNothingWithoutModels() {
            GenerationSettings settings = settings(List.of(), List.of(0.5), List.of(CONCISE));

            assertThat(service.generateMetadata(settings)).isEmpty();
            assertThat(service.countPossibilities(settings)).isZero();
        }

        @Test
        @DisplayName("should reject a non-positive token limit")
        void shouldRejectInvalidMaxTokens() {
            assertThatThrownBy(() -> new GenerationSettings(null, List.of(), List.of(), List.of(), 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should find a possibility by id")
        void shouldFindById() {
            GenerationSettings settings = settings(
                    List.of(new GenerationSettings.ModelOption("google", "gemini-1.5-flash")),
                    List.of(0.2, 0.9), List.of());

            assertThat(service.findById(settings, "google_gemini-1-5-flash_temp0.9_inst-default"))
                    .map(PossibilityMetadata::temperature)
                    .contains(0.9);
            assertThat(service.findById(settings, "missing")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Priority")
    class PriorityTiers {

        @Test
        @DisplayName("should rank popular models at standard temperature without instruction HIGH")
        void shouldRankHigh() {
            assertThat(service.calculatePriority("gpt-4o", 0.7, null)).isEqualTo(Priority.HIGH);
            assertThat(service.calculatePriority("gpt-4o", 0.75, null)).isEqualTo(Priority.HIGH);
        }

        @Test
        @DisplayName("should rank popular models or standard temperature MEDIUM")
        void shouldRankMedium() {
            assertThat(service.calculatePriority("gpt-4o", 0.7, CONCISE)).isEqualTo(Priority.MEDIUM);
            assertThat(service.calculatePriority("gpt-4o", 1.2, null)).isEqualTo(Priority.MEDIUM);
            assertThat(service.calculatePriority("some-model", 0.7, null)).isEqualTo(Priority.MEDIUM);
        }

        @Test
        @DisplayName("should rank everything else LOW")
        void shouldRankLow() {
            assertThat(service.calculatePriority("some-model", 0.2, null)).isEqualTo(Priority.LOW);
        }

        @Test
        @DisplayName("should sort prioritized metadata by tier then generation order")
        void shouldSortByPriority() {
            GenerationSettings settings = settings(
                    List.of(new GenerationSettings.ModelOption("together", "llama-3-70b"),
                            new GenerationSettings.ModelOption("openai", "gpt-4o")),
                    List.of(0.2, 0.7),
                    List.of());

            List<PossibilityMetadata> metadata = service.generatePrioritizedMetadata(settings);

            assertThat(metadata).extracting(PossibilityMetadata::priority).containsExactly(
                    Priority.MEDIUM, Priority.MEDIUM, Priority.MEDIUM, Priority.LOW);
            assertThat(metadata).extracting(PossibilityMetadata::id).containsExactly(
                    "together_llama-3-70b_temp0.7_inst-default",
                    "openai_gpt-4o_temp0.2_inst-default",
                    "openai_gpt-4o_temp0.7_inst-default",
                    "together_llama-3-70b_temp0.2_inst-default");
        }
    }

    @Nested
    @DisplayName("Loading time estimate")
    class LoadingTime {

        @Test
        @DisplayName("should scale the provider base time by model, temperature and instruction")
        void shouldEstimateLoadingTime() {
            PossibilityMetadata metadata = PossibilityMetadata.builder()
                    .id("x").provider("openai").model("gpt-4o").temperature(0.5)
                    .build();

            // 2000 * 1.5 * 1.1
            assertThat(service.estimateLoadingTime(metadata)).isEqualTo(Duration.ofMillis(3300));
        }

        @Test
        @DisplayName("should apply the small model and instruction multipliers")
        void shouldApplySmallModelMultiplier() {
            PossibilityMetadata metadata = PossibilityMetadata.builder()
                    .id("x").provider("anthropic").model("claude-3-5-haiku-20241022").temperature(0.0)
                    .systemInstruction(CONCISE)
                    .build();

            // 3000 * 0.8 * 1.0 * 1.2
            assertThat(service.estimateLoadingTime(metadata)).isEqualTo(Duration.ofMillis(2880));
        }

        @Test
        @DisplayName("should use the default base time for unknown providers")
        void shouldUseDefaultBaseTime() {
            PossibilityMetadata metadata = PossibilityMetadata.builder()
                    .id("x").provider("acme").model("model-a").temperature(0.0)
                    .build();

            assertThat(service.estimateLoadingTime(metadata)).isEqualTo(Duration.ofMillis(3000));
        }
    }
}
