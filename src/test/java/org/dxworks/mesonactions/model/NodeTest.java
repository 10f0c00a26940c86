package org.dxworks.mesonactions.model;

import org.dxworks.mesonactions.support.MesonTestParser;
import org.dxworks.mesonactions.support.Nodes;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class NodeTest {

    @Test
    void parentsPointToOwners() throws IOException {
        BuildDefinition root = MesonTestParser.parse(Paths.get("src/test/resources/samples/meson.build"));
        Deque<Node> owners = new ArrayDeque<>();
        int[] visited = {0};

        root.accept(new AbstractCodeVisitor() {
            @Override
            protected void visitChildren(Node node) {
                if (owners.isEmpty()) {
                    assertNull(node.getParent());
                } else {
                    assertSame(owners.peek(), node.getParent(), "parent of " + node.getClass().getSimpleName()
                            + " at " + node.getLocation());
                }
                visited[0]++;
                owners.push(node);
                super.visitChildren(node);
                owners.pop();
            }
        });

        assertTrue(visited[0] > 50);
    }

    @Test
    void traversalFollowsSourceOrder() {
        BuildDefinition root = MesonTestParser.parse("a = b + c\nforeach d : e\n  f(g, h: i)\nendforeach");

        List<String> ids = Nodes.findAll(root, IdExpression.class).stream()
                .map(IdExpression::getId)
                .collect(Collectors.toList());

        assertEquals(List.of("a", "b", "c", "d", "e", "f", "g", "h", "i"), ids);
    }

    @Test
    void selectionVisitsEachConditionBeforeItsBlock() {
        BuildDefinition root = MesonTestParser.parse("if a\n  b = 1\nelif c\n  d = 2\nelse\n  e = 3\nendif");

        List<String> ids = Nodes.findAll(root, IdExpression.class).stream()
                .map(IdExpression::getId)
                .collect(Collectors.toList());

        assertEquals(List.of("a", "b", "c", "d", "e"), ids);
        SelectionStatement selection = Nodes.first(root, SelectionStatement.class);
        assertTrue(selection.hasElseBlock());
        assertEquals(2, selection.getConditions().size());
    }

    @Test
    void nodeCannotBeOwnedTwice() {
        IdExpression id = new IdExpression(new Location(0, 0, 0, 1), "f");
        new FunctionExpression(new Location(0, 0, 0, 3), id, new ArgumentList(Location.at(0, 2), List.of()));

        assertThrows(IllegalStateException.class, () ->
                new FunctionExpression(new Location(0, 0, 0, 3), id, new ArgumentList(Location.at(0, 2), List.of())));
    }

    @Test
    void selectionNeedsOneBlockPerCondition() {
        Node condition = new BooleanLiteral(new Location(0, 3, 0, 7), true);

        assertThrows(IllegalArgumentException.class, () ->
                new SelectionStatement(new Location(0, 0, 1, 5), List.of(condition), List.of()));
    }

    @Test
    void locationRejectsInvertedSpans() {
        assertThrows(IllegalArgumentException.class, () -> new Location(1, 0, 0, 4));
        assertThrows(IllegalArgumentException.class, () -> new Location(0, -1, 0, 4));
        assertTrue(Location.at(2, 3).isEmpty());
        assertEquals(Location.at(0, 6), new Location(0, 2, 0, 6).endPoint());
    }

    @Test
    void parsedLocationsAreHalfOpen() {
        BuildDefinition root = MesonTestParser.parse("x = static_library('a', sources: ['a.c'])");

        FunctionExpression call = Nodes.first(root, FunctionExpression.class);
        assertEquals(new Location(0, 4, 0, 41), call.getLocation());
        assertEquals(new Location(0, 4, 0, 18), call.getId().getLocation());
        assertEquals(new Location(0, 19, 0, 40), call.getArgs().getLocation());
        assertEquals(new Location(0, 0, 0, 41), Nodes.first(root, AssignmentStatement.class).getLocation());
    }
}
