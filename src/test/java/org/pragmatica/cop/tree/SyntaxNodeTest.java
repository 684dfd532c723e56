package org.pragmatica.cop.tree;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SyntaxNodeTest {

    private static final SourceBuffer BUFFER = SourceBuffer.of("create :user");

    private static SyntaxNode node(String type, int start, int end, Child... children) {
        return SyntaxNode.of(type, List.of(children), NodeLocation.of(BUFFER, BUFFER.span(start, end)));
    }

    private static SyntaxNode createUser() {
        var sym = node("sym", 7, 12, Atom.sym("user"));
        return node("send", 0, 12, Atom.NIL, Atom.sym("create"), sym);
    }

    @Test
    void toString_rendersSExpression() {
        assertEquals("(send nil :create (sym :user))", createUser().toString());
    }

    @Test
    void childAccessors_distinguishNodesAndAtoms() {
        var call = createUser();

        assertEquals(3, call.arity());
        assertTrue(call.nodeAt(0).isEmpty());
        assertTrue(call.child(0).orElseThrow().isNil());
        assertEquals(Atom.sym("create"), call.atomAt(1).orElseThrow());
        assertEquals("sym", call.nodeAt(2).orElseThrow().type());
        assertTrue(call.child(3).isEmpty());
        assertTrue(call.child(-1).isEmpty());
    }

    @Test
    void source_returnsVerbatimText() {
        var call = createUser();

        assertEquals("create :user", call.source());
        assertEquals(":user", call.nodeAt(2).orElseThrow().source());
    }

    @Test
    void forEachNode_visitsInPreOrder() {
        var call = createUser();
        var visited = new ArrayList<String>();

        call.forEachNode(node -> visited.add(node.type()));

        assertThat(visited).containsExactly("send", "sym");
        assertThat(call.descendants()).hasSize(2);
    }

    @Test
    void location_withDelimiters_exposesDelimiterSource() {
        var buffer = SourceBuffer.of("create(:user)");
        var location = NodeLocation.of(buffer, buffer.span(0, 13))
                                   .withDelimiters(buffer.span(6, 7), buffer.span(12, 13))
                                   .withSelector(buffer.span(0, 6));

        assertEquals("(", location.beginSource().orElseThrow());
        assertEquals(")", location.endSource().orElseThrow());
        assertEquals("create", buffer.source(location.selector().orElseThrow()));
    }
}
