package build.tokenbuddy.manifest;

import build.tokenbuddy.Diagnostic;
import build.tokenbuddy.source.FileKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static build.tokenbuddy.manifest.ManifestFields.isTexts;
import static build.tokenbuddy.manifest.ManifestFields.text;
import static build.tokenbuddy.manifest.ManifestFields.texts;

public class UpftManifestFormat implements ManifestFormat {

    private static final Set<String> GENERATE_KEYS = Set.of("output",
            "includeSets",
            "excludeSets",
            "includeModifiers",
            "excludeModifiers");

    @Override
    public String name() {
        return "upft";
    }

    @Override
    public boolean detects(Object document) {
        if (!(document instanceof Map<?, ?> map)) {
            return false;
        } else if (FileKind.isModifiers(map.get("modifiers"))) {
            return true;
        }
        return map.get("sets") instanceof List<?> && !(map.get("version") instanceof String)
                && !map.containsKey("modifiers");
    }

    @Override
    public ManifestValidation validate(Object document) {
        List<Diagnostic> errors = new ArrayList<>(), warnings = new ArrayList<>();
        if (!(document instanceof Map<?, ?> manifest)) {
            errors.add(new Diagnostic("manifest", "Invalid UPFT manifest format"));
            return new ManifestValidation(errors, warnings);
        }
        if (!(manifest.get("sets") instanceof List<?> sets) || sets.isEmpty()) {
            errors.add(new Diagnostic("sets", "Manifest must have at least one token set"));
        } else {
            for (int index = 0; index < sets.size(); index++) {
                String path = "sets[" + index + "]";
                if (!(sets.get(index) instanceof Map<?, ?> set)) {
                    errors.add(new Diagnostic(path, "Token set must be an object"));
                } else if (!isTexts(files(set))) {
                    errors.add(new Diagnostic(path, "Token set must have a 'files' array"));
                } else if (((List<?>) files(set)).isEmpty()) {
                    warnings.add(new Diagnostic(path + ".files", "Token set has empty files array"));
                }
            }
        }
        if (manifest.containsKey("modifiers")) {
            if (!(manifest.get("modifiers") instanceof Map<?, ?> modifiers)) {
                errors.add(new Diagnostic("modifiers", "Modifiers must be an object"));
            } else {
                modifiers.forEach((name, modifier) -> validateModifier("modifiers." + name,
                        modifier,
                        errors,
                        warnings));
            }
        }
        if (manifest.containsKey("generate") && !(manifest.get("generate") instanceof List<?> generate
                && generate.stream().allMatch(Map.class::isInstance))) {
            errors.add(new Diagnostic("generate", "Generate must be an array of objects"));
        }
        return new ManifestValidation(errors, warnings);
    }

    private static void validateModifier(String path,
                                         Object value,
                                         List<Diagnostic> errors,
                                         List<Diagnostic> warnings) {
        if (!(value instanceof Map<?, ?> modifier)) {
            errors.add(new Diagnostic(path, "Modifier must be an object"));
            return;
        }
        List<String> options;
        if (modifier.containsKey("oneOf") && modifier.containsKey("anyOf")) {
            errors.add(new Diagnostic(path, "Modifier cannot declare both oneOf and anyOf"));
            return;
        } else if (modifier.containsKey("oneOf")) {
            options = texts(modifier.get("oneOf"));
            if (!isTexts(modifier.get("oneOf")) || options.isEmpty()) {
                errors.add(new Diagnostic(path + ".oneOf", "OneOf modifier must have values"));
            }
        } else if (modifier.containsKey("anyOf")) {
            options = texts(modifier.get("anyOf"));
            if (!isTexts(modifier.get("anyOf")) || options.isEmpty()) {
                errors.add(new Diagnostic(path + ".anyOf", "AnyOf modifier must have values"));
            }
        } else {
            errors.add(new Diagnostic(path, "Modifier must declare oneOf or anyOf"));
            return;
        }
        if (!(modifier.get("values") instanceof Map<?, ?> values) || values.isEmpty()) {
            errors.add(new Diagnostic(path + ".values", "Modifier must have values mapping"));
        } else {
            values.forEach((option, files) -> {
                if (!options.contains(String.valueOf(option))) {
                    warnings.add(new Diagnostic(path + ".values." + option,
                            "Value '" + option + "' is not a declared option"));
                }
                if (!(files instanceof String) && !isTexts(files)) {
                    errors.add(new Diagnostic(path + ".values." + option,
                            "Modifier values must map to a file or a list of files"));
                }
            });
        }
        for (String option : texts(modifier.get("default"))) {
            if (!options.contains(option)) {
                errors.add(new Diagnostic(path + ".default", "Default value '" + option + "' is not an option"));
            }
        }
    }

    @Override
    public Manifest parse(Object document, String file) {
        Map<?, ?> manifest = (Map<?, ?>) document;
        List<TokenSet> sets = new ArrayList<>();
        List<?> declared = (List<?>) manifest.get("sets");
        for (int index = 0; index < declared.size(); index++) {
            Map<?, ?> set = (Map<?, ?>) declared.get(index);
            String name = text(set, "name");
            sets.add(new TokenSet(name == null ? "set-" + index : name,
                    texts(files(set)),
                    text(set, "description")));
        }
        Map<String, Modifier> modifiers = new LinkedHashMap<>();
        if (manifest.get("modifiers") instanceof Map<?, ?> declaredModifiers) {
            declaredModifiers.forEach((key, value) -> {
                String name = String.valueOf(key);
                Map<?, ?> modifier = (Map<?, ?>) value;
                boolean oneOf = modifier.containsKey("oneOf");
                Map<String, List<String>> values = new LinkedHashMap<>();
                ((Map<?, ?>) modifier.get("values")).forEach((option, files) -> values.put(String.valueOf(option),
                        texts(files)));
                modifiers.put(name, new Modifier(name,
                        oneOf ? Modifier.Constraint.ONE_OF : Modifier.Constraint.ANY_OF,
                        texts(modifier.get(oneOf ? "oneOf" : "anyOf")),
                        values,
                        texts(modifier.get("default")),
                        text(modifier, "description")));
            });
        }
        List<GenerateSpec> generate = new ArrayList<>();
        if (manifest.get("generate") instanceof List<?> requests) {
            for (Object request : requests) {
                generate.add(toGenerateSpec((Map<?, ?>) request));
            }
        }
        String name = text(manifest, "name");
        return new Manifest(name == null ? "manifest" : name, name(), file, sets, modifiers, generate, Map.of());
    }

    // Sets might list their files under "values", as modifiers do.
    private static Object files(Map<?, ?> set) {
        return set.containsKey("files") ? set.get("files") : set.get("values");
    }

    private static GenerateSpec toGenerateSpec(Map<?, ?> request) {
        Map<String, Object> selections = new LinkedHashMap<>();
        request.forEach((key, value) -> {
            String name = String.valueOf(key);
            if (!GENERATE_KEYS.contains(name) && !name.startsWith("$")) {
                selections.put(name, value instanceof List<?> ? texts(value) : value);
            }
        });
        return new GenerateSpec(text(request, "output"),
                selections,
                texts(request.get("includeSets")),
                texts(request.get("excludeSets")),
                texts(request.get("includeModifiers")),
                texts(request.get("excludeModifiers")));
    }
}
