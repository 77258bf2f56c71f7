package build.tokenbuddy.manifest;

import build.tokenbuddy.Diagnostic;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static build.tokenbuddy.manifest.ManifestFields.isTexts;
import static build.tokenbuddy.manifest.ManifestFields.text;
import static build.tokenbuddy.manifest.ManifestFields.texts;

public class DtcgManifestFormat implements ManifestFormat {

    public static final String INCLUDED = "enabled";

    @Override
    public String name() {
        return "dtcg";
    }

    @Override
    public boolean detects(Object document) {
        if (!(document instanceof Map<?, ?> map)
                || !(map.get("version") instanceof String)
                || !(map.get("sets") instanceof List<?> sets)
                || sets.isEmpty()
                || !sets.stream().allMatch(Map.class::isInstance)) {
            return false;
        } else if (!map.containsKey("modifiers")) {
            return true;
        }
        return map.get("modifiers") instanceof List<?> modifiers && modifiers.stream().allMatch(modifier ->
                modifier instanceof Map<?, ?> value
                        && ("enumerated".equals(value.get("type")) || "include".equals(value.get("type"))));
    }

    @Override
    public ManifestValidation validate(Object document) {
        List<Diagnostic> errors = new ArrayList<>(), warnings = new ArrayList<>();
        if (!(document instanceof Map<?, ?> manifest)) {
            errors.add(new Diagnostic("manifest", "Manifest must be an object"));
            return new ManifestValidation(errors, warnings);
        }
        if (!(manifest.get("version") instanceof String)) {
            errors.add(new Diagnostic("version", "Manifest must declare a version"));
        }
        if (!(manifest.get("sets") instanceof List<?> sets) || sets.isEmpty()) {
            errors.add(new Diagnostic("sets", "Manifest must have at least one token set"));
        } else {
            for (int index = 0; index < sets.size(); index++) {
                validateSet("sets[" + index + "]", sets.get(index), errors);
            }
        }
        if (manifest.get("modifiers") instanceof List<?> modifiers) {
            for (int index = 0; index < modifiers.size(); index++) {
                validateModifier("modifiers[" + index + "]", modifiers.get(index), errors, warnings);
            }
        } else if (manifest.containsKey("modifiers")) {
            errors.add(new Diagnostic("modifiers", "Modifiers must be an array"));
        }
        return new ManifestValidation(errors, warnings);
    }

    private static void validateSet(String path, Object value, List<Diagnostic> errors) {
        if (!(value instanceof Map<?, ?> set)) {
            errors.add(new Diagnostic(path, "Token set must be an object"));
        } else if (!(set.get("source") instanceof String) && !(set.get("tokens") instanceof Map<?, ?>)) {
            errors.add(new Diagnostic(path, "Token set must have either 'source' or 'tokens'"));
        }
    }

    private static void validateModifier(String path,
                                         Object value,
                                         List<Diagnostic> errors,
                                         List<Diagnostic> warnings) {
        if (!(value instanceof Map<?, ?> modifier)) {
            errors.add(new Diagnostic(path, "Modifier must be an object"));
            return;
        }
        if (text(modifier, "name") == null) {
            errors.add(new Diagnostic(path + ".name", "Modifier must have a name"));
        }
        String type = text(modifier, "type");
        if ("enumerated".equals(type)) {
            List<String> options = texts(modifier.get("values"));
            if (!isTexts(modifier.get("values")) || options.isEmpty()) {
                errors.add(new Diagnostic(path + ".values", "Enumerated modifier must have values"));
            }
            if (modifier.get("sets") instanceof Map<?, ?> sets) {
                sets.forEach((option, selected) -> {
                    if (!options.contains(String.valueOf(option))) {
                        warnings.add(new Diagnostic(path + ".sets." + option,
                                "Value '" + option + "' is not a declared option"));
                    }
                    validateSets(path + ".sets." + option, selected, errors);
                });
            } else if (modifier.containsKey("sets")) {
                errors.add(new Diagnostic(path + ".sets", "Enumerated modifier sets must be an object"));
            }
        } else if ("include".equals(type)) {
            if (!(modifier.get("include") instanceof List<?>)) {
                errors.add(new Diagnostic(path + ".include", "Include modifier must have include sets"));
            } else {
                validateSets(path + ".include", modifier.get("include"), errors);
            }
        } else {
            errors.add(new Diagnostic(path + ".type", "Modifier type must be 'enumerated' or 'include'"));
        }
    }

    private static void validateSets(String path, Object value, List<Diagnostic> errors) {
        if (!(value instanceof List<?> sets)) {
            errors.add(new Diagnostic(path, "Expected an array of token sets"));
            return;
        }
        for (int index = 0; index < sets.size(); index++) {
            validateSet(path + "[" + index + "]", sets.get(index), errors);
        }
    }

    @Override
    public Manifest parse(Object document, String file) {
        Map<?, ?> manifest = (Map<?, ?>) document;
        Map<String, Object> virtualFiles = new LinkedHashMap<>();
        List<TokenSet> sets = new ArrayList<>();
        List<?> declared = (List<?>) manifest.get("sets");
        for (int index = 0; index < declared.size(); index++) {
            Map<?, ?> set = (Map<?, ?>) declared.get(index);
            String name = "set-" + index;
            String source = text(set, "source");
            if (source == null) {
                source = name + ".virtual.json";
                virtualFiles.put(source, set.get("tokens"));
            }
            sets.add(new TokenSet(name, List.of(source), text(set, "description")));
        }
        Map<String, Modifier> modifiers = new LinkedHashMap<>();
        if (manifest.get("modifiers") instanceof List<?> declaredModifiers) {
            for (Object value : declaredModifiers) {
                Map<?, ?> modifier = (Map<?, ?>) value;
                String name = text(modifier, "name");
                Map<String, List<String>> values = new LinkedHashMap<>();
                if ("enumerated".equals(modifier.get("type"))) {
                    List<String> options = texts(modifier.get("values"));
                    if (modifier.get("sets") instanceof Map<?, ?> selected) {
                        selected.forEach((option, files) -> values.put(String.valueOf(option),
                                toFiles((List<?>) files, name, String.valueOf(option), virtualFiles)));
                    }
                    modifiers.put(name, new Modifier(name,
                            Modifier.Constraint.ONE_OF,
                            options,
                            values,
                            List.of(),
                            text(modifier, "description")));
                } else {
                    values.put(INCLUDED, toFiles((List<?>) modifier.get("include"), name, "include", virtualFiles));
                    modifiers.put(name, new Modifier(name,
                            Modifier.Constraint.ANY_OF,
                            List.of(INCLUDED),
                            values,
                            List.of(),
                            text(modifier, "description")));
                }
            }
        }
        String name = text(manifest, "name");
        return new Manifest(name == null ? "dtcg-resolver" : name,
                name(),
                file,
                sets,
                modifiers,
                List.of(),
                virtualFiles);
    }

    private static List<String> toFiles(List<?> sets, String modifier, String suffix, Map<String, Object> virtualFiles) {
        List<String> files = new ArrayList<>();
        for (int index = 0; index < sets.size(); index++) {
            Map<?, ?> set = (Map<?, ?>) sets.get(index);
            String source = text(set, "source");
            if (source == null) {
                source = modifier + "-" + suffix + "-" + index + ".virtual.json";
                virtualFiles.put(source, set.get("tokens"));
            }
            files.add(source);
        }
        return files;
    }
}
