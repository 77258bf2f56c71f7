package build.tokenbuddy.manifest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class ManifestFormats {

    private final Map<String, ManifestFormat> formats;

    private ManifestFormats(Map<String, ManifestFormat> formats) {
        this.formats = formats;
    }

    public static ManifestFormats builtIn() {
        Map<String, ManifestFormat> formats = new LinkedHashMap<>();
        formats.put("upft", new UpftManifestFormat());
        formats.put("dtcg", new DtcgManifestFormat());
        return new ManifestFormats(Collections.unmodifiableMap(formats));
    }

    public static ManifestFormats empty() {
        return new ManifestFormats(Map.of());
    }

    public ManifestFormats with(ManifestFormat format) {
        if (formats.containsKey(format.name())) {
            throw new IllegalArgumentException("Manifest format already registered: " + format.name());
        }
        Map<String, ManifestFormat> formats = new LinkedHashMap<>(this.formats);
        formats.put(format.name(), format);
        return new ManifestFormats(Collections.unmodifiableMap(formats));
    }

    public List<String> names() {
        return new ArrayList<>(formats.keySet());
    }

    public ManifestFormat detect(Object document) {
        List<ManifestFormat> claims = formats.values().stream()
                .filter(format -> format.detects(document))
                .toList();
        if (claims.isEmpty()) {
            throw new ManifestException("Unknown manifest format. Available formats: "
                    + String.join(", ", formats.keySet()));
        } else if (claims.size() > 1) {
            throw new ManifestException("Ambiguous manifest format, claimed by: " + claims.stream()
                    .map(ManifestFormat::name)
                    .collect(Collectors.joining(", ")));
        }
        return claims.get(0);
    }

    public ManifestValidation validate(Object document) {
        return detect(document).validate(document);
    }

    public Manifest parse(Object document, String file) {
        ManifestFormat format = detect(document);
        ManifestValidation validation = format.validate(document);
        if (!validation.isValid()) {
            throw new ManifestException("Invalid " + format.name() + " manifest " + file, validation.errors());
        }
        return format.parse(document, file);
    }
}
