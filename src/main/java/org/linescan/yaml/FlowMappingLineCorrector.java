package org.linescan.yaml;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.scanner.Scanner;
import org.yaml.snakeyaml.tokens.Token;

import java.util.Objects;

/**
 * Scanner decorator that watches the tokens the parser consumes and decides, for every key of a
 * flow mapping, whether the value that follows is stamped with the mapping's start line instead
 * of the line the value begins on. An entry is an inline key context when
 * <ul>
 *     <li>it is the first key and sits on the line of the opening <code>{</code>, or</li>
 *     <li>it was introduced by a <code>,</code> immediately followed by a key marker.</li>
 * </ul>
 */
public final class FlowMappingLineCorrector implements Scanner {

    private final Scanner delegate;
    private Token.ID previousToken;
    private boolean entryFollowedByKey;

    public FlowMappingLineCorrector(Scanner delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate scanner must not be null");
    }

    // --- Scanner ---

    @Override
    public boolean checkToken(Token.ID... choices) {
        return delegate.checkToken(choices);
    }

    @Override
    public Token peekToken() {
        return delegate.peekToken();
    }

    @Override
    public Token getToken() {
        Token token = delegate.getToken();
        track(token.getTokenId());
        return token;
    }

    // --- Line correction ---

    /**
     * Evaluates the key about to be composed in {@code mapping} and records the decision on the
     * context. Block mappings are left untouched.
     *
     * @param mapping  mapping node under composition
     * @param keyStart start mark of the upcoming key
     * @param context  per-parse state receiving the flag
     */
    public void beforeKey(MappingNode mapping, Mark keyStart, ParserContext context) {
        if (mapping.getFlowStyle() != DumperOptions.FlowStyle.FLOW) {
            return;
        }
        context.setInlineMappingKeyPending(isInlineMappingKey(mapping, keyStart));
    }

    boolean isInlineMappingKey(MappingNode mapping, Mark keyStart) {
        boolean first = mapping.getValue().isEmpty();
        boolean inline = (first && mapping.getStartMark().getLine() == keyStart.getLine())
                || entryFollowedByKey;
        // one decision per separator
        entryFollowedByKey = false;
        return inline;
    }

    private void track(Token.ID id) {
        if (id == Token.ID.FlowEntry) {
            entryFollowedByKey = false;
        } else if (id == Token.ID.Key) {
            entryFollowedByKey = previousToken == Token.ID.FlowEntry;
        }
        previousToken = id;
    }
}
