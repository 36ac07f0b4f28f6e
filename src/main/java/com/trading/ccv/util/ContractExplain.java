package com.trading.ccv.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

import com.trading.ccv.engine.ValuationEngine;
import com.trading.ccv.market.MarketModel;
import com.trading.ccv.model.And;
import com.trading.ccv.model.Anytime;
import com.trading.ccv.model.Contract;
import com.trading.ccv.model.ContractKind;
import com.trading.ccv.model.Give;
import com.trading.ccv.model.One;
import com.trading.ccv.model.Or;
import com.trading.ccv.model.Scale;
import com.trading.ccv.model.Then;
import com.trading.ccv.model.Truncate;
import com.trading.ccv.model.When;

/**
 * Diagnostic renderings of contract trees.
 *
 * <p>
 * Intended for debugging sessions and error reports. Allocates freely; keep it
 * off the revaluation thread.
 */
public final class ContractExplain {
    private final ValuationEngine engine;

    /**
     * @param engine values subtrees for the annotated outputs; may be
     *               {@code null} when only structure is needed.
     */
    public ContractExplain(ValuationEngine engine) {
        this.engine = engine;
    }

    /**
     * Indented one-node-per-line dump.
     */
    public static String dumpTree(Contract contract) {
        StringBuilder sb = new StringBuilder(256);
        Deque<Object[]> stack = new ArrayDeque<>();
        stack.push(new Object[] { contract, 0 });
        while (!stack.isEmpty()) {
            Object[] frame = stack.pop();
            Contract c = (Contract) frame[0];
            int depth = (Integer) frame[1];
            sb.append("  ".repeat(depth)).append(label(c)).append('\n');
            List<Contract> kids = children(c);
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.push(new Object[] { kids.get(i), depth + 1 });
            }
        }
        return sb.toString();
    }

    /**
     * Mermaid flowchart of the tree. When an engine is configured and a
     * market is given, every node carries the standalone value of its
     * subtree.
     */
    public String toMermaid(Contract contract, MarketModel model) {
        StringBuilder nodes = new StringBuilder(1024);
        StringBuilder edges = new StringBuilder(1024);
        nodes.append("graph TD;\n");
        int[] counter = { 0 };
        appendMermaid(contract, model, nodes, edges, counter);
        return nodes.append(edges).toString();
    }

    public String toMermaid(Contract contract) {
        return toMermaid(contract, null);
    }

    private int appendMermaid(Contract c, MarketModel model, StringBuilder nodes, StringBuilder edges,
            int[] counter) {
        int id = counter[0]++;
        nodes.append("  n").append(id).append("[\"").append(escape(label(c)));
        if (engine != null && model != null) {
            nodes.append("<br/><b>").append(String.format(Locale.US, "%.4f", engine.value(c, model, 0).amount()))
                    .append("</b>");
        }
        nodes.append("\"];\n");
        for (Contract child : children(c)) {
            int childId = appendMermaid(child, model, nodes, edges, counter);
            edges.append("  n").append(id).append(" --> n").append(childId).append(";\n");
        }
        return id;
    }

    /**
     * Values each leg of the top-level {@code And} chain separately, one line
     * per leg followed by the total.
     */
    public String explainLegs(Contract contract, MarketModel model, int time) {
        if (engine == null) {
            throw new IllegalStateException("explainLegs needs a valuation engine");
        }
        List<Contract> legs = new ArrayList<>();
        Deque<Contract> stack = new ArrayDeque<>();
        stack.push(contract);
        while (!stack.isEmpty()) {
            Contract c = stack.pop();
            if (c.kind() == ContractKind.AND) {
                stack.push(((And) c).right());
                stack.push(((And) c).left());
            } else {
                legs.add(c);
            }
        }
        StringBuilder sb = new StringBuilder(256);
        double total = 0.0;
        for (int i = 0; i < legs.size(); i++) {
            double v = engine.value(legs.get(i), model, time).amount();
            total += v;
            sb.append(String.format(Locale.US, "  leg %-3d %14.6f  %s%n", i, v, label(legs.get(i))));
        }
        sb.append(String.format(Locale.US, "  total   %14.6f  %s%n", total, model.baseCurrency()));
        return sb.toString();
    }

    static String label(Contract c) {
        return switch (c.kind()) {
            case ZERO -> "Zero";
            case ONE -> "One " + ((One) c).currency();
            case GIVE -> "Give";
            case AND -> "And";
            case OR -> "Or";
            case THEN -> "Then day " + ((Then) c).day();
            case SCALE -> "Scale " + ((Scale) c).observable();
            case WHEN -> "When " + ((When) c).condition();
            case TRUNCATE -> "Truncate day " + ((Truncate) c).day();
            case ANYTIME -> "Anytime " + ((Anytime) c).condition();
        };
    }

    static List<Contract> children(Contract c) {
        return switch (c.kind()) {
            case ZERO, ONE -> List.of();
            case GIVE -> List.of(((Give) c).contract());
            case AND -> List.of(((And) c).left(), ((And) c).right());
            case OR -> List.of(((Or) c).left(), ((Or) c).right());
            case THEN -> List.of(((Then) c).contract());
            case SCALE -> List.of(((Scale) c).contract());
            case WHEN -> List.of(((When) c).contract());
            case TRUNCATE -> List.of(((Truncate) c).contract());
            case ANYTIME -> List.of(((Anytime) c).contract());
        };
    }

    private static String escape(String s) {
        return s.replace("\"", "#quot;").replace("<", "#lt;").replace(">", "#gt;");
    }
}
