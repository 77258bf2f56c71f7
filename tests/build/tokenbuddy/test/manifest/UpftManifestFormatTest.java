package build.tokenbuddy.test.manifest;

import build.tokenbuddy.Diagnostic;
import build.tokenbuddy.Json;
import build.tokenbuddy.manifest.GenerateSpec;
import build.tokenbuddy.manifest.Manifest;
import build.tokenbuddy.manifest.ManifestValidation;
import build.tokenbuddy.manifest.Modifier;
import build.tokenbuddy.manifest.TokenSet;
import build.tokenbuddy.manifest.UpftManifestFormat;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class UpftManifestFormatTest {

    private final UpftManifestFormat format = new UpftManifestFormat();

    @Test
    public void can_parse_manifest() {
        Object document = Json.parse("""
                {
                  "name": "brand",
                  "sets": [
                    { "name": "core", "files": ["core/colors.json", "core/spacing.json"] },
                    { "files": ["semantic.json"], "description": "Semantic aliases" }
                  ],
                  "modifiers": {
                    "theme": {
                      "oneOf": ["light", "dark"],
                      "values": { "light": ["theme/light.json"], "dark": ["theme/dark.json"] },
                      "default": "dark"
                    },
                    "features": {
                      "anyOf": ["compact", "contrast"],
                      "values": { "compact": "features/compact.json", "contrast": ["features/contrast.json"] },
                      "description": "Optional features"
                    }
                  },
                  "generate": [
                    { "theme": "light", "features": ["compact"], "output": "light.json" },
                    { "includeModifiers": ["theme"], "excludeSets": ["core"], "output": "themes.json" }
                  ]
                }
                """);
        assertThat(format.detects(document)).isTrue();
        assertThat(format.validate(document).isValid()).isTrue();
        Manifest manifest = format.parse(document, "manifest.json");
        assertThat(manifest.name()).isEqualTo("brand");
        assertThat(manifest.format()).isEqualTo("upft");
        assertThat(manifest.file()).isEqualTo("manifest.json");
        assertThat(manifest.sets()).containsExactly(
                new TokenSet("core", List.of("core/colors.json", "core/spacing.json"), null),
                new TokenSet("set-1", List.of("semantic.json"), "Semantic aliases"));
        Modifier theme = manifest.modifiers().get("theme");
        assertThat(theme.constraint()).isEqualTo(Modifier.Constraint.ONE_OF);
        assertThat(theme.options()).containsExactly("light", "dark");
        assertThat(theme.files("dark")).containsExactly("theme/dark.json");
        assertThat(theme.defaults()).containsExactly("dark");
        Modifier features = manifest.modifiers().get("features");
        assertThat(features.constraint()).isEqualTo(Modifier.Constraint.ANY_OF);
        assertThat(features.files("compact")).containsExactly("features/compact.json");
        assertThat(features.defaults()).isEmpty();
        assertThat(features.description()).isEqualTo("Optional features");
        assertThat(manifest.generate()).containsExactly(
                new GenerateSpec("light.json",
                        Map.of("theme", "light", "features", List.of("compact")),
                        List.of(),
                        List.of(),
                        List.of(),
                        List.of()),
                new GenerateSpec("themes.json", Map.of(), List.of(), List.of("core"), List.of("theme"), List.of()));
        assertThat(manifest.files()).containsExactly("core/colors.json",
                "core/spacing.json",
                "semantic.json",
                "theme/light.json",
                "theme/dark.json",
                "features/compact.json",
                "features/contrast.json");
        assertThat(manifest.virtualFiles()).isEmpty();
    }

    @Test
    public void can_default_one_of_modifier_to_first_option() {
        Manifest manifest = format.parse(Json.parse("""
                {
                  "sets": [ { "files": ["base.json"] } ],
                  "modifiers": { "density": { "oneOf": ["regular", "dense"], "values": { "dense": ["dense.json"] } } }
                }
                """), "manifest.json");
        assertThat(manifest.name()).isEqualTo("manifest");
        assertThat(manifest.modifiers().get("density").defaults()).containsExactly("regular");
        assertThat(manifest.modifiers().get("density").files("regular")).isEmpty();
    }

    @Test
    public void can_report_validation_errors() {
        ManifestValidation validation = format.validate(Json.parse("""
                {
                  "sets": [],
                  "modifiers": {
                    "theme": { "oneOf": [], "values": {} },
                    "features": { "anyOf": ["a"], "values": { "a": ["a.json"], "b": ["b.json"] }, "default": ["c"] },
                    "broken": { "values": { "x": "x.json" } }
                  }
                }
                """));
        assertThat(validation.isValid()).isFalse();
        assertThat(validation.errors()).containsExactly(
                new Diagnostic("sets", "Manifest must have at least one token set"),
                new Diagnostic("modifiers.theme.oneOf", "OneOf modifier must have values"),
                new Diagnostic("modifiers.theme.values", "Modifier must have values mapping"),
                new Diagnostic("modifiers.features.default", "Default value 'c' is not an option"),
                new Diagnostic("modifiers.broken", "Modifier must declare oneOf or anyOf"));
        assertThat(validation.warnings()).containsExactly(
                new Diagnostic("modifiers.features.values.b", "Value 'b' is not a declared option"));
    }

    @Test
    public void can_warn_about_empty_set() {
        ManifestValidation validation = format.validate(Json.parse("""
                { "sets": [ { "files": [] }, { "name": "other" } ], "modifiers": {} }
                """));
        assertThat(validation.errors()).containsExactly(new Diagnostic("sets[1]", "Token set must have a 'files' array"));
        assertThat(validation.warnings()).containsExactly(new Diagnostic("sets[0].files", "Token set has empty files array"));
    }

    @Test
    public void can_parse_set_with_values() {
        Object document = Json.parse("""
                { "sets": [ { "name": "base", "values": ["base.json"] } ], "modifiers": {} }
                """);
        assertThat(format.detects(document)).isTrue();
        assertThat(format.validate(document).isValid()).isTrue();
        assertThat(format.parse(document, "manifest.json").sets())
                .containsExactly(new TokenSet("base", List.of("base.json"), null));
    }
}
