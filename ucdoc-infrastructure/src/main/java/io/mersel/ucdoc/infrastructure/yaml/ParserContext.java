package io.mersel.ucdoc.infrastructure.yaml;

import io.mersel.ucdoc.application.interfaces.StructuralReferenceException;
import io.mersel.ucdoc.application.interfaces.UniquenessViolationException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Tanım ağacında o an işlenen konumun noktalı yolu.
 * <p>
 * Hatalar bu yol ile raporlanır: {@code usecases.UC01.basicFlows.B01.playerId}.
 */
public final class ParserContext {

    private final Deque<String> path = new ArrayDeque<>();

    public ParserContext push(String segment) {
        path.addLast(segment);
        return this;
    }

    public void pop() {
        path.removeLast();
    }

    public String path() {
        StringBuilder sb = new StringBuilder();
        Iterator<String> it = path.iterator();
        while (it.hasNext()) {
            sb.append(it.next());
            if (it.hasNext()) {
                sb.append('.');
            }
        }
        return sb.toString();
    }

    public StructuralReferenceException structural(String message) {
        return new StructuralReferenceException(path(), message);
    }

    public UniquenessViolationException duplicate(String id) {
        return new UniquenessViolationException(path(), id);
    }
}
