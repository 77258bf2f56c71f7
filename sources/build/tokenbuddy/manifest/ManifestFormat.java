package build.tokenbuddy.manifest;

public interface ManifestFormat {

    String name();

    boolean detects(Object document);

    ManifestValidation validate(Object document);

    Manifest parse(Object document, String file);
}
