package com.codemend.core.context;

import java.util.List;

/**
 * Line-level outline of a source file, grouped by what each line declares.
 */
public final class FileStructureAnalysis {

    public static final FileStructureAnalysis EMPTY =
            new FileStructureAnalysis(List.of(), List.of(), List.of(), List.of(), List.of(), List.of());

    private final List<Entry> imports;
    private final List<Entry> exports;
    private final List<Entry> functions;
    private final List<Entry> classes;
    private final List<Entry> variables;
    private final List<Entry> comments;

    public FileStructureAnalysis(List<Entry> imports, List<Entry> exports, List<Entry> functions,
                                 List<Entry> classes, List<Entry> variables, List<Entry> comments) {
        this.imports   = List.copyOf(imports);
        this.exports   = List.copyOf(exports);
        this.functions = List.copyOf(functions);
        this.classes   = List.copyOf(classes);
        this.variables = List.copyOf(variables);
        this.comments  = List.copyOf(comments);
    }

    public List<Entry> getImports()   { return imports; }
    public List<Entry> getExports()   { return exports; }
    public List<Entry> getFunctions() { return functions; }
    public List<Entry> getClasses()   { return classes; }
    public List<Entry> getVariables() { return variables; }
    public List<Entry> getComments()  { return comments; }

    /**
     * Short paragraph for correction instructions. Empty when nothing was
     * recognized.
     */
    public String toPromptSection() {
        StringBuilder sb = new StringBuilder();
        appendCount(sb, "Imports", imports.size(), "lines");
        appendCount(sb, "Exports", exports.size(), "lines");
        appendCount(sb, "Functions", functions.size(), "functions");
        appendCount(sb, "Classes", classes.size(), "classes");
        appendCount(sb, "Variables", variables.size(), "variables");
        appendCount(sb, "Comments", comments.size(), "lines");
        if (sb.length() == 0) return "";
        return "File structure:\n" + sb
                + "Keep this organization consistent when applying changes.\n";
    }

    private static void appendCount(StringBuilder sb, String label, int count, String unit) {
        if (count > 0) {
            sb.append("- ").append(label).append(": ").append(count).append(" ").append(unit).append("\n");
        }
    }

    public static final class Entry {
        private final int    line;
        private final String content;

        public Entry(int line, String content) {
            this.line    = line;
            this.content = content;
        }

        public int    getLine()    { return line; }
        public String getContent() { return content; }

        @Override public String toString() { return line + ": " + content; }
    }
}
