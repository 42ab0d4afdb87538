package org.astrewrite.ast;

import java.util.List;

/**
 * A set of source files that together build a package.
 */
public class PackageNode extends AbstractNode {

    private final String name;
    private List<FileNode> files;

    public PackageNode(String name, List<FileNode> files) {
        this.name = name;
        this.files = NodeLists.copyOf(files);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PACKAGE;
    }

    public String getName() {
        return name;
    }

    public List<FileNode> getFiles() {
        return files;
    }

    public void setFiles(List<FileNode> files) {
        this.files = NodeLists.copyOf(files);
    }

    @Override
    public String describe() {
        return "Package(name=" + name + ")";
    }
}
