package com.example.sample;

import java.util.List;

public class ReportBuilder {

    private final StringBuilder out = new StringBuilder();

    public String build(List<String> lines) {
        for (String line : lines) {
            append(line);
            audit(line);
        }
        System.out.println("built " + lines.size() + " lines");
        return out.toString();
    }

    private void append(String line) {
        out.append(line).append('\n');
    }

    private void audit(String line) {
        int i = 0;
        while (i < line.length()) {
            i++;
        }
    }
}
