package im.arun.codex.order;

import im.arun.codex.config.CodexConfig;
import im.arun.codex.model.DropPosition;
import im.arun.codex.model.IndexNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Fractional sibling ordering. A new order value lands strictly between its two
 * neighbours, so a single insert leaves every other sibling untouched.
 * <p>
 * Midpoints halve the gap every time; once the gap around the drop target falls
 * below {@code minOrderGap}, {@link #place} renumbers the siblings to
 * {@code step, 2*step, ...} and computes the value again.
 */
public class OrderCalculator {
    private static final Logger logger = LoggerFactory.getLogger(OrderCalculator.class);

    private final double minOrderGap;
    private final double orderStep;

    public OrderCalculator() {
        this(new CodexConfig());
    }

    public OrderCalculator(CodexConfig config) {
        this.minOrderGap = config.getMinOrderGap();
        this.orderStep = config.getOrderStep();
    }

    /**
     * Order value for an item dropped relative to {@code target}. {@code siblings} is
     * the target's sibling list (target included); its order does not matter.
     */
    public double calculate(IndexNode target, DropPosition position, List<IndexNode> siblings) {
        double targetOrder = target.orderOrZero();

        if (position == DropPosition.INSIDE) {
            List<IndexNode> children = sorted(target.childNodes());
            return children.isEmpty() ? 0.0 : children.get(0).orderOrZero() - 1;
        }

        List<IndexNode> ordered = sorted(siblings);
        int index = indexOf(ordered, target);
        if (index < 0) {
            throw new IllegalArgumentException("Target '" + target.getId() + "' is not among its siblings");
        }

        if (position == DropPosition.BEFORE) {
            if (index == 0) {
                return targetOrder - 1;
            }
            return (ordered.get(index - 1).orderOrZero() + targetOrder) / 2;
        }

        if (index == ordered.size() - 1) {
            return targetOrder + 1;
        }
        Double successorOrder = ordered.get(index + 1).getOrder();
        double next = successorOrder != null ? successorOrder : targetOrder + 2;
        return (targetOrder + next) / 2;
    }

    /**
     * Like {@link #calculate} but renumbers {@code siblings} first when the gap around
     * the target is too small to split.
     */
    public Placement place(IndexNode target, DropPosition position, List<IndexNode> siblings) {
        if (position != DropPosition.INSIDE && gapAround(target, position, siblings) < minOrderGap) {
            logger.info("Order gap next to '{}' below {}, renumbering {} siblings",
                target.getId(), minOrderGap, siblings.size());
            renumber(siblings);
            return new Placement(calculate(target, position, siblings), true);
        }
        return new Placement(calculate(target, position, siblings), false);
    }

    /**
     * Rewrites the orders of {@code siblings} to {@code step, 2*step, ...} keeping
     * their current relative order.
     */
    public void renumber(List<IndexNode> siblings) {
        List<IndexNode> ordered = sorted(siblings);
        for (int i = 0; i < ordered.size(); i++) {
            ordered.get(i).setOrder(orderStep * (i + 1));
        }
    }

    /**
     * Distance between the target and the neighbour on the drop side; infinite when
     * the target is at that boundary. Missing orders count as 0, so unordered
     * siblings always get renumbered.
     */
    double gapAround(IndexNode target, DropPosition position, List<IndexNode> siblings) {
        List<IndexNode> ordered = sorted(siblings);
        int index = indexOf(ordered, target);
        if (index < 0) {
            return Double.POSITIVE_INFINITY;
        }
        int neighbour = position == DropPosition.BEFORE ? index - 1 : index + 1;
        if (neighbour < 0 || neighbour >= ordered.size()) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.abs(target.orderOrZero() - ordered.get(neighbour).orderOrZero());
    }

    private static List<IndexNode> sorted(List<IndexNode> nodes) {
        List<IndexNode> copy = new ArrayList<>(nodes);
        copy.sort(Comparator.comparingDouble(IndexNode::orderOrZero));
        return copy;
    }

    /**
     * Position of {@code target}, matched by identity first and by id second.
     */
    private static int indexOf(List<IndexNode> nodes, IndexNode target) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == target) {
                return i;
            }
        }
        if (target.getId() != null) {
            for (int i = 0; i < nodes.size(); i++) {
                if (target.getId().equals(nodes.get(i).getId())) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * A computed order value and whether the siblings had to be renumbered for it.
     */
    public static class Placement {
        private final double order;
        private final boolean renumbered;

        public Placement(double order, boolean renumbered) {
            this.order = order;
            this.renumbered = renumbered;
        }

        public double getOrder() {
            return order;
        }

        public boolean isRenumbered() {
            return renumbered;
        }
    }
}
