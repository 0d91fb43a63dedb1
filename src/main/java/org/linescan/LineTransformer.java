package org.linescan;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Turns a structured document into plain lines a line-oriented scanner can process as if they
 * were the original source text.
 */
public interface LineTransformer {

    /**
     * @param filename file name or path, only its extension is inspected
     * @return whether this transformer understands the file
     */
    boolean shouldParseFile(String filename);

    /**
     * @param file document to transform
     * @return reconstructed lines, index 0 holding line 1
     * @throws IOException     if the file cannot be read
     * @throws ParsingFailure  if the document is not well-formed
     */
    List<String> parseFile(File file) throws IOException, ParsingFailure;
}
