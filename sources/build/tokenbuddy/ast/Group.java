package build.tokenbuddy.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Group implements Node {

    private final String path, name, description, type;
    private final List<Node> children = new ArrayList<>();

    public Group(String path, String name, String description, String type) {
        this.path = path;
        this.name = name;
        this.description = description;
        this.type = type;
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public String type() {
        return type;
    }

    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    public List<Token> tokens() {
        return children.stream().filter(Token.class::isInstance).map(Token.class::cast).toList();
    }

    public List<Group> groups() {
        return children.stream().filter(Group.class::isInstance).map(Group.class::cast).toList();
    }

    void add(Node child) {
        children.add(child);
    }

    @Override
    public String toString() {
        return "Group{" + path + "}";
    }
}
