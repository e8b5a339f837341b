package org.atsp.tour.problem;

import lombok.experimental.UtilityClass;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StreamTokenizer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads TSPLIB-style explicit distance matrices.
 *
 * <p>The input is scanned as whitespace-separated tokens. {@code DIMENSION:} is followed by
 * the city count; everything up to {@code EDGE_WEIGHT_SECTION} is skipped; then exactly
 * {@code dimension * dimension} weights follow in row-major order. Trailing tokens
 * (for example {@code EOF}) are ignored.</p>
 */
@UtilityClass
public class DistanceMatrixReader {
    static final String DIMENSION_KEY = "DIMENSION:";
    static final String WEIGHT_SECTION_KEY = "EDGE_WEIGHT_SECTION";

    /**
     * Reads a problem from a file.
     *
     * @param path matrix file.
     * @return parsed problem.
     * @throws IOException when the file cannot be read.
     * @throws ProblemDefinitionException when the content is malformed.
     */
    public static Problem read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    /**
     * Reads a problem from a character stream. The stream is not closed.
     *
     * @param reader matrix text.
     * @return parsed problem.
     * @throws IOException when the stream fails.
     * @throws ProblemDefinitionException when the content is malformed.
     */
    public static Problem read(Reader reader) throws IOException {
        StreamTokenizer tokens = newTokenizer(reader);
        int dimension = -1;
        boolean weightSection = false;
        while (!weightSection && tokens.nextToken() != StreamTokenizer.TT_EOF) {
            String word = tokens.sval;
            if (DIMENSION_KEY.equals(word)) {
                dimension = parseDimension(nextWord(tokens, "dimension value"));
            } else if (WEIGHT_SECTION_KEY.equals(word)) {
                weightSection = true;
            }
        }
        if (dimension < 0) {
            throw formatError("missing " + DIMENSION_KEY + " entry");
        }
        if (!weightSection) {
            throw formatError("missing " + WEIGHT_SECTION_KEY);
        }

        double[][] matrix = new double[dimension][dimension];
        for (int i = 0; i < dimension; i++) {
            for (int j = 0; j < dimension; j++) {
                matrix[i][j] = parseWeight(nextWord(tokens, "weight (" + i + ", " + j + ")"), i, j);
            }
        }
        return Problem.fromDistanceMatrix(dimension, matrix);
    }

    private static StreamTokenizer newTokenizer(Reader reader) {
        StreamTokenizer tokens = new StreamTokenizer(reader);
        tokens.resetSyntax();
        tokens.wordChars(0x21, 0x7E);
        tokens.wordChars(0xA0, Character.MAX_VALUE);
        tokens.whitespaceChars(0x00, 0x20);
        return tokens;
    }

    private static String nextWord(StreamTokenizer tokens, String expected) throws IOException {
        if (tokens.nextToken() == StreamTokenizer.TT_EOF) {
            throw formatError("unexpected end of input, expected " + expected);
        }
        return tokens.sval;
    }

    private static int parseDimension(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new ProblemDefinitionException(
                    ProblemDefinitionException.REASON_MATRIX_FORMAT,
                    "dimension is not an integer: " + raw,
                    ex
            );
        }
    }

    private static double parseWeight(String raw, int row, int column) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new ProblemDefinitionException(
                    ProblemDefinitionException.REASON_MATRIX_FORMAT,
                    "weight (" + row + ", " + column + ") is not numeric: " + raw,
                    ex
            );
        }
    }

    private static ProblemDefinitionException formatError(String message) {
        return new ProblemDefinitionException(ProblemDefinitionException.REASON_MATRIX_FORMAT, message);
    }
}
