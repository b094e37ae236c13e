package fr.uga.amdn.cnf;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;

/**
 * Writes a weighted CNF problem in the DIMACS {@code wcnf} format. Hard clauses carry the sentinel weight declared
 * on the problem line.
 */
public class WcnfWriter {

    public void write(WeightedCnf cnf, Map<Integer, String> variableNames, Writer out) throws IOException {
        for (Map.Entry<Integer, String> entry : variableNames.entrySet()) {
            out.write("c " + entry.getKey() + " " + entry.getValue() + "\n");
        }
        out.write("p wcnf " + cnf.getVariableCount() + " " + cnf.getClauses().size() + " "
            + cnf.getHardWeight() + "\n");
        for (WeightedClause clause : cnf.getClauses()) {
            StringBuilder line = new StringBuilder();
            line.append(clause.getWeight());
            for (int literal : clause.getLiterals()) {
                line.append(' ').append(literal);
            }
            line.append(" 0\n");
            out.write(line.toString());
        }
        out.flush();
    }

    public void write(WeightedCnf cnf, Map<Integer, String> variableNames, Path file) throws IOException {
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(cnf, variableNames, out);
        }
    }

    public String toString(WeightedCnf cnf) {
        StringWriter out = new StringWriter();
        try {
            write(cnf, Collections.emptyMap(), out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }
}
