package build.tokenbuddy.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public final class Token implements Node {

    private final String path, name, declaredType, inheritedType, description;
    private final Object value;
    private final Map<String, Object> extensions;
    private final Reference reference;
    private final List<String> errors = new ArrayList<>(), warnings = new ArrayList<>();

    private Object resolvedValue;
    private String resolvedType;
    private int referenceDepth = -1;
    private boolean valid = true;

    public Token(String path,
                 String name,
                 String declaredType,
                 String inheritedType,
                 Object value,
                 String description,
                 Map<String, Object> extensions,
                 Reference reference) {
        this.path = path;
        this.name = name;
        this.declaredType = declaredType;
        this.inheritedType = inheritedType;
        this.value = value;
        this.description = description;
        this.extensions = extensions;
        this.reference = reference;
        resolvedValue = value;
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public String name() {
        return name;
    }

    public String declaredType() {
        return declaredType;
    }

    public String inheritedType() {
        return inheritedType;
    }

    public Object value() {
        return value;
    }

    public String description() {
        return description;
    }

    public Map<String, Object> extensions() {
        return Collections.unmodifiableMap(extensions);
    }

    public boolean hasReference() {
        return reference != null;
    }

    public Reference reference() {
        return reference;
    }

    public Object resolvedValue() {
        return resolvedValue;
    }

    public void resolvedValue(Object resolvedValue) {
        this.resolvedValue = resolvedValue;
    }

    public String resolvedType() {
        return resolvedType;
    }

    public void resolvedType(String resolvedType) {
        this.resolvedType = resolvedType;
    }

    public int referenceDepth() {
        return referenceDepth;
    }

    public void referenceDepth(int referenceDepth) {
        this.referenceDepth = referenceDepth;
    }

    public boolean isValid() {
        return valid;
    }

    public List<String> errors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public void invalidate(String error) {
        valid = false;
        if (!errors.contains(error)) {
            errors.add(error);
        }
    }

    public void warn(String warning) {
        if (!warnings.contains(warning)) {
            warnings.add(warning);
        }
    }

    @Override
    public String toString() {
        return "Token{" + path + (valid ? "" : ", invalid") + "}";
    }
}
