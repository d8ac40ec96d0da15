package com.codemend.core.context;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Keyword-based outline of a file. Each line lands in at most one bucket,
 * tested in the order imports, exports, functions, classes, variables,
 * comments.
 */
@Component
public class FileStructureAnalyzer {

    public FileStructureAnalysis analyze(String content) {
        if (content == null || content.isEmpty()) return FileStructureAnalysis.EMPTY;

        List<FileStructureAnalysis.Entry> imports   = new ArrayList<>();
        List<FileStructureAnalysis.Entry> exports   = new ArrayList<>();
        List<FileStructureAnalysis.Entry> functions = new ArrayList<>();
        List<FileStructureAnalysis.Entry> classes   = new ArrayList<>();
        List<FileStructureAnalysis.Entry> variables = new ArrayList<>();
        List<FileStructureAnalysis.Entry> comments  = new ArrayList<>();

        String[] lines = content.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            FileStructureAnalysis.Entry entry = new FileStructureAnalysis.Entry(i + 1, line);

            if (line.startsWith("import ")) {
                imports.add(entry);
            } else if (line.startsWith("export ")) {
                exports.add(entry);
            } else if (line.contains("function ") || line.contains("=>")) {
                functions.add(entry);
            } else if (line.contains("class ")) {
                classes.add(entry);
            } else if (line.contains("const ") || line.contains("let ") || line.contains("var ")) {
                variables.add(entry);
            } else if (line.startsWith("//") || line.startsWith("/*")) {
                comments.add(entry);
            }
        }
        return new FileStructureAnalysis(imports, exports, functions, classes, variables, comments);
    }
}
