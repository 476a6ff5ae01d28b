package im.arun.codex.order;

import im.arun.codex.config.CodexConfig;
import im.arun.codex.model.DropPosition;
import im.arun.codex.model.IndexNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OrderCalculatorTest {

    private final OrderCalculator calculator = new OrderCalculator();

    private static IndexNode node(String id, Double order) {
        IndexNode node = new IndexNode(id, "chapter", id);
        node.setOrder(order);
        return node;
    }

    @Test
    void beforeFirstIsOneLess() {
        IndexNode a = node("a", 1.0);
        IndexNode b = node("b", 2.0);
        assertThat(calculator.calculate(a, DropPosition.BEFORE, List.of(a, b))).isEqualTo(0.0);
    }

    @Test
    void beforeIsMidpointWithPredecessor() {
        IndexNode a = node("a", 1.0);
        IndexNode b = node("b", 2.0);
        assertThat(calculator.calculate(b, DropPosition.BEFORE, List.of(a, b))).isEqualTo(1.5);
    }

    @Test
    void afterLastIsOneMore() {
        IndexNode a = node("a", 1.0);
        IndexNode b = node("b", 2.0);
        assertThat(calculator.calculate(b, DropPosition.AFTER, List.of(a, b))).isEqualTo(3.0);
    }

    @Test
    void afterLiesStrictlyBetweenNeighbours() {
        double[][] pairs = {{0, 1}, {-5, 7.5}, {1, 1.000001}, {100, 1e6}, {-2, -1}};
        for (double[] pair : pairs) {
            IndexNode a = node("a", pair[0]);
            IndexNode b = node("b", pair[1]);
            double value = calculator.calculate(a, DropPosition.AFTER, List.of(b, a));
            assertThat(value).as("after %s with successor %s", pair[0], pair[1])
                .isGreaterThan(pair[0])
                .isLessThan(pair[1]);
        }
    }

    @Test
    void missingOrdersCountAsZero() {
        IndexNode a = node("a", null);
        IndexNode b = node("b", 4.0);
        assertThat(calculator.calculate(a, DropPosition.AFTER, List.of(a, b))).isEqualTo(2.0);
        assertThat(calculator.calculate(a, DropPosition.BEFORE, List.of(a, b))).isEqualTo(-1.0);
    }

    @Test
    void insideGoesBeforeFirstChild() {
        IndexNode folder = node("folder", 1.0);
        folder.setChildren(new ArrayList<>(List.of(node("x", 3.0), node("y", 2.0))));
        assertThat(calculator.calculate(folder, DropPosition.INSIDE, List.of())).isEqualTo(1.0);

        IndexNode empty = node("empty", 5.0);
        assertThat(calculator.calculate(empty, DropPosition.INSIDE, List.of())).isEqualTo(0.0);
    }

    @Test
    void targetMatchedByIdWhenNotTheSameInstance() {
        IndexNode a = node("a", 1.0);
        IndexNode b = node("b", 2.0);
        IndexNode copyOfA = node("a", 1.0);
        assertThat(calculator.calculate(copyOfA, DropPosition.AFTER, List.of(a, b))).isEqualTo(1.5);
    }

    @Test
    void placeRenumbersWhenGapIsExhausted() {
        CodexConfig config = new CodexConfig();
        config.setMinOrderGap(1e-3);
        OrderCalculator strict = new OrderCalculator(config);

        IndexNode a = node("a", 1.0);
        IndexNode b = node("b", 1.0005);
        IndexNode c = node("c", 3.0);
        List<IndexNode> siblings = List.of(c, a, b);

        OrderCalculator.Placement placement = strict.place(a, DropPosition.AFTER, siblings);

        assertThat(placement.isRenumbered()).isTrue();
        assertThat(a.getOrder()).isEqualTo(1.0);
        assertThat(b.getOrder()).isEqualTo(2.0);
        assertThat(c.getOrder()).isEqualTo(3.0);
        assertThat(placement.getOrder()).isEqualTo(1.5);
    }

    @Test
    void placeKeepsSiblingsWhenGapIsWide() {
        IndexNode a = node("a", 1.0);
        IndexNode b = node("b", 2.0);

        OrderCalculator.Placement placement = calculator.place(a, DropPosition.AFTER, List.of(a, b));

        assertThat(placement.isRenumbered()).isFalse();
        assertThat(placement.getOrder()).isEqualTo(1.5);
        assertThat(b.getOrder()).isEqualTo(2.0);
    }

    @Test
    void repeatedInsertionsStayOrdered() {
        IndexNode a = node("a", 0.0);
        IndexNode b = node("b", 1.0);
        List<IndexNode> siblings = new ArrayList<>(List.of(a, b));

        // Keep inserting right after "a"; renumbering must step in before precision runs out
        for (int i = 0; i < 200; i++) {
            IndexNode inserted = node("n" + i, null);
            OrderCalculator.Placement placement = calculator.place(a, DropPosition.AFTER, siblings);
            inserted.setOrder(placement.getOrder());
            assertThat(inserted.getOrder()).isGreaterThan(a.getOrder());
            siblings.add(inserted);
        }

        assertThat(b.getOrder()).isGreaterThan(a.getOrder());
        assertThat(siblings.stream().mapToDouble(IndexNode::orderOrZero).distinct().count())
            .isEqualTo(siblings.size());
    }

    @Test
    void renumberUsesConfiguredStep() {
        CodexConfig config = new CodexConfig();
        config.setOrderStep(10);
        OrderCalculator tens = new OrderCalculator(config);
        IndexNode a = node("a", 0.3);
        IndexNode b = node("b", 0.1);

        tens.renumber(List.of(a, b));

        assertThat(b.getOrder()).isCloseTo(10.0, within(1e-12));
        assertThat(a.getOrder()).isCloseTo(20.0, within(1e-12));
    }
}
