package build.tokenbuddy.ast;

public sealed interface Node permits Token, Group {

    String path();

    String name();
}
