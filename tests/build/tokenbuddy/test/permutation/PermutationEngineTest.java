package build.tokenbuddy.test.permutation;

import build.tokenbuddy.Json;
import build.tokenbuddy.ResolutionCallback;
import build.tokenbuddy.ast.TokenAnalysis;
import build.tokenbuddy.ast.TokenAst;
import build.tokenbuddy.manifest.GenerateSpec;
import build.tokenbuddy.manifest.Manifest;
import build.tokenbuddy.manifest.ManifestFormats;
import build.tokenbuddy.merge.MergeConflictException;
import build.tokenbuddy.permutation.ModifierInput;
import build.tokenbuddy.permutation.Permutation;
import build.tokenbuddy.permutation.PermutationBatch;
import build.tokenbuddy.permutation.PermutationEngine;
import build.tokenbuddy.permutation.PermutationException;
import build.tokenbuddy.permutation.PermutationRequest;
import build.tokenbuddy.permutation.ValidationPolicy;
import build.tokenbuddy.project.Project;
import build.tokenbuddy.project.ProjectResolver;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PermutationEngineTest {

    private static final String THEMED = """
            {
              "sets": [ { "files": ["base.json"] } ],
              "modifiers": {
                "theme": { "oneOf": ["light", "dark"], "values": { "light": ["light.json"], "dark": ["dark.json"] } }
              }
            }
            """;

    @Test
    public void can_resolve_permutation() {
        Project project = project(THEMED,
                "base.json", """
                        { "color": { "primary": { "$value": "#000", "$type": "color" } } }
                        """,
                "light.json", """
                        { "color": { "primary": { "$value": "#111" } } }
                        """,
                "dark.json", """
                        {
                          "color": { "primary": { "$value": { "$ref": "#/dark-primary" } } },
                          "dark-primary": { "$value": "#fff" }
                        }
                        """);
        Permutation permutation = engine(project).resolve(ModifierInput.empty().with("theme", "dark"));
        assertThat(permutation.id()).isEqualTo("theme-dark");
        assertThat(permutation.input()).isEqualTo(Map.of("theme", "dark"));
        assertThat(permutation.files()).containsExactly("base.json", "dark.json");
        assertThat(permutation.output()).isNull();
        assertThat(permutation.tokens()).isEqualTo(Json.parse("""
                {
                  "color": { "primary": { "$value": "#fff", "$type": "color" } },
                  "dark-primary": { "$value": "#fff" }
                }
                """));
        assertThat(permutation.metadata().totalTokens()).isEqualTo(2);
        assertThat(permutation.metadata().resolvedTokens()).isEqualTo(2);
        assertThat(permutation.metadata().unresolvedTokens()).isZero();
        assertThat(permutation.metadata().errors()).isEmpty();
        assertThat(project.files().get("dark.json").document()).isEqualTo(Json.parse("""
                {
                  "color": { "primary": { "$value": { "$ref": "#/dark-primary" } } },
                  "dark-primary": { "$value": "#fff" }
                }
                """));
    }

    @Test
    public void can_default_unassigned_one_of_modifier() {
        Project project = project(THEMED,
                "base.json", "{ \"a\": { \"$value\": 1 } }",
                "light.json", "{ \"a\": { \"$value\": 2 } }",
                "dark.json", "{ \"a\": { \"$value\": 3 } }");
        Permutation permutation = engine(project).resolve(ModifierInput.empty());
        assertThat(permutation.id()).isEqualTo("theme-light");
        assertThat(permutation.files()).containsExactly("base.json", "light.json");
        assertThat(permutation.tokens()).isEqualTo(Json.parse("{ \"a\": { \"$value\": 2 } }"));
    }

    @Test
    public void can_count_one_of_combinations() {
        Project project = project("""
                {
                  "sets": [ { "files": ["base.json"] } ],
                  "modifiers": {
                    "theme": { "oneOf": ["light", "dark", "dim"], "values": { "light": ["light.json"] } },
                    "density": { "oneOf": ["regular", "compact"], "values": { "compact": ["compact.json"] } }
                  }
                }
                """, "base.json", "{ \"a\": { \"$value\": 1 } }");
        List<PermutationRequest> requests = engine(project).exhaustive();
        assertThat(requests).hasSize(6);
        assertThat(requests).extracting(request -> request.input().id()).containsExactly(
                "density-regular&theme-light",
                "density-compact&theme-light",
                "density-regular&theme-dark",
                "density-compact&theme-dark",
                "density-regular&theme-dim",
                "density-compact&theme-dim");
        PermutationBatch batch = engine(project).generate();
        assertThat(batch.permutations()).hasSize(6);
        assertThat(batch.isComplete()).isTrue();
    }

    @Test
    public void can_count_any_of_combinations() {
        Project project = project("""
                {
                  "sets": [ { "files": ["base.json"] } ],
                  "modifiers": {
                    "features": { "anyOf": ["x", "y", "z"], "values": { "x": ["x.json"], "y": ["y.json"], "z": ["z.json"] } }
                  }
                }
                """,
                "base.json", "{ \"a\": { \"$value\": 1 } }",
                "x.json", "{ \"x\": { \"$value\": 1 } }",
                "y.json", "{ \"y\": { \"$value\": 1 } }",
                "z.json", "{ \"z\": { \"$value\": 1 } }");
        List<PermutationRequest> requests = engine(project).exhaustive();
        assertThat(requests).hasSize(8);
        assertThat(requests.get(0).input().id()).isEqualTo(ModifierInput.DEFAULT);
        assertThat(requests.get(7).input().id()).isEqualTo("features-x,y,z");
        ExecutorService executorService = Executors.newFixedThreadPool(3);
        try {
            PermutationBatch batch = new PermutationEngine(project,
                    executorService,
                    ResolutionCallback.nop(),
                    ValidationPolicy.CONTINUE).generate();
            assertThat(batch.permutations()).extracting(Permutation::id).doesNotHaveDuplicates().hasSize(8);
            assertThat(batch.permutations().get(7).files()).containsExactly("base.json", "x.json", "y.json", "z.json");
        } finally {
            executorService.shutdown();
        }
    }

    @Test
    public void can_collect_any_of_files_in_option_order() {
        Project project = project("""
                {
                  "sets": [ { "files": ["base.json"] } ],
                  "modifiers": {
                    "features": { "anyOf": ["x", "y"], "values": { "x": ["x.json", "base.json"], "y": ["y.json"] } }
                  }
                }
                """,
                "base.json", "{ \"a\": { \"$value\": 1 } }",
                "x.json", "{ \"a\": { \"$value\": 2 } }",
                "y.json", "{ \"a\": { \"$value\": 3 } }");
        Permutation permutation = engine(project).resolve(ModifierInput.empty().with("features", List.of("y", "x")));
        assertThat(permutation.files()).containsExactly("base.json", "x.json", "y.json");
        assertThat(permutation.tokens()).isEqualTo(Json.parse("{ \"a\": { \"$value\": 3 } }"));
        assertThat(permutation.id()).isEqualTo("features-x,y");
    }

    @Test
    public void can_continue_on_invalid_input() {
        Project project = project(THEMED,
                "base.json", "{ \"a\": { \"$value\": 1 } }",
                "light.json", "{ \"a\": { \"$value\": 2 } }",
                "dark.json", "{ \"a\": { \"$value\": 3 } }");
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("theme", "sepia");
        input.put("unknown", "x");
        input.put("output", "ignored.json");
        Permutation permutation = engine(project).resolve(ModifierInput.of(input));
        assertThat(permutation.metadata().errors()).containsExactly(
                "Invalid value \"sepia\" for modifier theme. Valid options: light, dark",
                "Unknown modifier: unknown");
        assertThat(permutation.files()).containsExactly("base.json");
        assertThat(permutation.id()).isEqualTo(ModifierInput.DEFAULT);
        Permutation typed = engine(project).resolve(ModifierInput.empty().with("theme", List.of("dark")));
        assertThat(typed.metadata().errors()).containsExactly("Modifier theme requires a single string value");
    }

    @Test
    public void can_abort_on_invalid_input() {
        Project project = project(THEMED,
                "base.json", "{ \"a\": { \"$value\": 1 } }",
                "light.json", "{ \"a\": { \"$value\": 2 } }",
                "dark.json", "{ \"a\": { \"$value\": 3 } }");
        PermutationEngine engine = new PermutationEngine(project, Runnable::run, ResolutionCallback.nop(), ValidationPolicy.ABORT);
        assertThatThrownBy(() -> engine.resolve(ModifierInput.empty().with("theme", "sepia")))
                .isInstanceOf(PermutationException.class)
                .hasMessageContaining("Invalid value \"sepia\" for modifier theme");
    }

    @Test
    public void can_isolate_failing_permutation() {
        Project project = project("""
                {
                  "sets": [ { "files": ["base.json"] } ],
                  "modifiers": {
                    "mode": { "oneOf": ["ok", "bad"], "values": { "ok": ["ok.json"], "bad": ["bad.json"] } }
                  }
                }
                """,
                "base.json", "{ \"a\": { \"$value\": 1 } }",
                "ok.json", "{ \"a\": { \"$value\": 2 } }",
                "bad.json", "{ \"a\": { \"b\": { \"$value\": 3 } } }");
        PermutationBatch batch = engine(project).generate();
        assertThat(batch.permutations()).extracting(Permutation::id).containsExactly("mode-ok");
        assertThat(batch.failures()).containsOnlyKeys("mode-bad");
        assertThat(batch.failures().get("mode-bad"))
                .isInstanceOf(PermutationException.class)
                .hasCauseInstanceOf(MergeConflictException.class);
        assertThat(batch.isComplete()).isFalse();
    }

    @Test
    public void can_leave_multi_hop_and_multi_reference_values_unresolved() {
        Project project = project("""
                { "sets": [ { "files": ["base.json"] } ], "modifiers": {} }
                """, "base.json", """
                {
                  "a": { "$value": "#000000" },
                  "b": { "$value": "{a}" },
                  "c": { "$value": "{b}" },
                  "border": { "$type": "border", "$value": { "color": "{a}", "width": "1px", "style": "solid" } },
                  "gradient": { "$value": [ "{a}", "{b}" ] },
                  "missing": { "$value": "{nowhere}" }
                }
                """);
        Permutation permutation = engine(project).resolve(ModifierInput.empty());
        Map<String, Object> tokens = permutation.tokens();
        assertThat(value(tokens, "b")).isEqualTo("#000000");
        assertThat(value(tokens, "c")).isEqualTo("{b}");
        assertThat(value(tokens, "border")).isEqualTo(Map.of("color", "#000000", "width", "1px", "style", "solid"));
        assertThat(value(tokens, "gradient")).isEqualTo(List.of("{a}", "{b}"));
        assertThat(permutation.metadata().unresolvedTokens()).isEqualTo(3);
        assertThat(permutation.metadata().resolvedTokens()).isEqualTo(3);
        assertThat(permutation.metadata().errors()).containsExactly("missing: Reference to non-existent token: {nowhere}");
        assertThat(permutation.metadata().warnings()).containsExactly(
                "Token c references b which is itself a reference and was left unresolved",
                "Token gradient has multiple references and was left unresolved");
    }

    @Test
    public void can_generate_directed_permutations() {
        Project project = project("""
                {
                  "sets": [ { "name": "core", "files": ["base.json"] }, { "name": "extra", "files": ["extra.json"] } ],
                  "modifiers": {
                    "theme": { "oneOf": ["light", "dark"], "values": { "light": ["light.json"], "dark": ["dark.json"] } },
                    "features": { "anyOf": ["x", "y"], "values": { "x": ["x.json"], "y": ["y.json"] } }
                  },
                  "generate": [
                    { "includeModifiers": ["theme"], "excludeSets": ["extra"], "output": "dist/tokens.json" },
                    { "theme": "dark", "features": "*", "output": "all.json" }
                  ]
                }
                """,
                "base.json", "{ \"a\": { \"$value\": 1 } }",
                "extra.json", "{ \"e\": { \"$value\": 1 } }",
                "light.json", "{ \"a\": { \"$value\": 2 } }",
                "dark.json", "{ \"a\": { \"$value\": 3 } }",
                "x.json", "{ \"x\": { \"$value\": 1 } }",
                "y.json", "{ \"y\": { \"$value\": 1 } }");
        PermutationBatch batch = engine(project).generate();
        assertThat(batch.isComplete()).isTrue();
        assertThat(batch.permutations()).extracting(Permutation::output)
                .containsExactly("dist/tokens-light.json", "dist/tokens-dark.json", "all.json");
        assertThat(batch.permutations()).extracting(Permutation::id)
                .containsExactly("theme-light", "theme-dark", "features-x,y&theme-dark");
        assertThat(batch.permutations().get(0).files()).containsExactly("base.json", "light.json");
        assertThat(batch.permutations().get(2).files())
                .containsExactly("base.json", "extra.json", "dark.json", "x.json", "y.json");
    }

    @Test
    public void can_pin_values_and_prefer_inclusion() {
        Project project = project("""
                {
                  "sets": [ { "name": "core", "files": ["base.json"] }, { "name": "extra", "files": ["extra.json"] } ],
                  "modifiers": {
                    "theme": { "oneOf": ["light", "dark"], "values": { "light": ["light.json"], "dark": ["dark.json"] } },
                    "density": { "oneOf": ["regular", "compact"], "values": { "compact": ["compact.json"] } }
                  }
                }
                """, "base.json", "{ \"a\": { \"$value\": 1 } }");
        List<PermutationRequest> requests = engine(project).directed(new GenerateSpec("out.json",
                Map.of(),
                List.of("extra"),
                List.of("*"),
                List.of("theme:dark", "density"),
                List.of("density")));
        assertThat(requests).extracting(PermutationRequest::output)
                .containsExactly("out-regular.json", "out-compact.json");
        assertThat(requests).allSatisfy(request -> assertThat(request.sets()).containsExactly("extra"));
        assertThat(requests.get(1).input().values()).isEqualTo(Map.of("theme", "dark", "density", "compact"));
        List<PermutationRequest> excluded = engine(project).directed(new GenerateSpec(null,
                Map.of(),
                List.of(),
                List.of(),
                List.of(),
                List.of("density")));
        assertThat(excluded).singleElement().satisfies(request -> {
            assertThat(request.output()).isEqualTo("output.json");
            assertThat(request.input().values()).isEqualTo(Map.of("theme", "light"));
            assertThat(request.sets()).containsExactly("core", "extra");
        });
    }

    @Test
    public void can_resolve_external_reference_relative_to_declaring_file() {
        Project project = project("""
                { "sets": [ { "files": ["themes/dark.json"] } ], "modifiers": {} }
                """,
                "palette.json", "{ \"blue\": { \"$value\": \"#ff0000\" } }",
                "themes/palette.json", "{ \"blue\": { \"$value\": \"#0000ff\" } }",
                "themes/dark.json", "{ \"accent\": { \"$value\": { \"$ref\": \"./palette.json#/blue\" } } }");
        Permutation permutation = engine(project).resolve(ModifierInput.empty());
        assertThat(value(permutation.tokens(), "accent")).isEqualTo("#0000ff");
        assertThat(permutation.metadata().crossFileReferences()).isEqualTo(1);
        assertThat(permutation.metadata().warnings()).isEmpty();
    }

    @Test
    public void cannot_enumerate_any_of_modifier_with_too_many_options() {
        String options = IntStream.range(0, 31)
                .mapToObj(index -> "\"o" + index + "\"")
                .collect(Collectors.joining(", "));
        Project project = project("""
                {
                  "sets": [ { "files": ["base.json"] } ],
                  "modifiers": { "flags": { "anyOf": [%s], "values": { "o0": ["o0.json"] } } }
                }
                """.formatted(options), "base.json", "{ \"a\": { \"$value\": 1 } }");
        assertThatThrownBy(() -> engine(project).exhaustive())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("flags with 31 options");
    }

    @Test
    public void cannot_create_engine_without_manifest() {
        assertThatThrownBy(() -> new PermutationEngine(Project.of("root", null, Map.of()),
                Runnable::run,
                ResolutionCallback.nop(),
                ValidationPolicy.CONTINUE)).isInstanceOf(IllegalArgumentException.class);
    }

    private static Object value(Map<String, Object> tokens, String name) {
        return Json.asObject(tokens.get(name)).get("$value");
    }

    private static PermutationEngine engine(Project project) {
        return new PermutationEngine(project, Runnable::run, ResolutionCallback.nop(), ValidationPolicy.CONTINUE);
    }

    private static Project project(String manifest, String... entries) {
        Manifest parsed = ManifestFormats.builtIn().parse(Json.parse(manifest), "manifest.json");
        Map<String, TokenAst> files = new LinkedHashMap<>();
        for (int index = 0; index < entries.length; index += 2) {
            files.put(entries[index], TokenAnalysis.analyze(entries[index], Json.parse(entries[index + 1])));
        }
        return new ProjectResolver().resolve("root", parsed, files).project();
    }
}
