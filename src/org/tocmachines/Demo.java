/*
 * @LICENSE@
 */

package org.tocmachines;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.tocmachines.notation.ConversionResult;
import org.tocmachines.notation.ExpressionConverter;
import org.tocmachines.notation.Notation;
import org.tocmachines.notation.ValidationResult;
import org.tocmachines.trie.Combos;
import org.tocmachines.trie.Input;
import org.tocmachines.trie.Pattern;
import org.tocmachines.trie.PatternCatalogue;
import org.tocmachines.trie.TrieMatcher;

/**
 * Command line demonstration.
 * <p>
 * Without arguments, prints the combo table, replays every combo through a
 * {@link TrieMatcher} and runs a few validations and conversions. With
 * arguments <code>&lt;notation&gt; &lt;expression...&gt;</code>, converts the
 * expression to all three notations, e.g.
 * <code>Demo postfix 3 4 + 2 *</code>.
 */
public final class Demo {

    private static final String RULE =
        "-----------------------------------------------------------------";

    private final PrintStream out;
    private final ExpressionConverter converter = new ExpressionConverter();

    Demo(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        Demo demo = new Demo(System.out);
        if (args.length == 0) {
            demo.combos();
            demo.expressions();
            return;
        }
        Notation notation = parseNotation(args[0]);
        if (notation == null || args.length < 2) {
            System.err.println("usage: Demo [infix|postfix|prefix <expression...>]");
            System.exit(2);
        }
        StringBuilder expr = new StringBuilder();
        for (String a : Arrays.asList(args).subList(1, args.length)) {
            if (expr.length() > 0) expr.append(' ');
            expr.append(a);
        }
        System.exit(demo.convertAll(expr.toString(), notation) ? 0 : 1);
    }

    static Notation parseNotation(String s) {
        for (Notation n : Notation.values()) {
            if (n.label().equalsIgnoreCase(s)) return n;
        }
        return null;
    }

    void combos() {
        PatternCatalogue<Input> catalogue = Combos.defaultCatalogue();
        out.println(Combos.table(catalogue));
        TrieMatcher<Input> matcher = new TrieMatcher<Input>(catalogue);
        out.println("Trie: " + matcher.nodeCount() + " states");
        for (Pattern<Input> p : catalogue.patterns()) {
            String label = null;
            for (Input in : p.sequence()) {
                label = matcher.processInput(in);
            }
            out.println("  " + Combos.display(p.sequence()) + "  =>  " + label);
        }
        out.println();
    }

    void expressions() {
        out.println(RULE);
        out.println("Validation and conversion");
        out.println(RULE);
        show(1, "(3+4)*2", Notation.INFIX);
        show(2, "3 4 + 2 *", Notation.POSTFIX);
        show(3, "* + 3 4 2", Notation.PREFIX);
        show(4, "(3+4*2", Notation.INFIX);
        out.println(RULE);
    }

    private void show(int n, String expr, Notation notation) {
        ValidationResult v = converter.validator().validate(expr, notation);
        out.println("[" + n + "] " + notation.label() + ": " + expr);
        out.println("    Valid: " + v.isValid());
        out.println("    Message: " + v.message());
        if (v.isValid()) {
            for (Notation target : Notation.values()) {
                if (target == notation) continue;
                out.println("    -> " + target.label() + ": "
                        + converter.convert(expr, notation, target).resultExpression());
            }
        }
        out.println();
    }

    boolean convertAll(String expr, Notation source) {
        Map<Notation, ConversionResult> all = converter.convertToAll(expr, source);
        boolean ok = true;
        for (Map.Entry<Notation, ConversionResult> e : all.entrySet()) {
            ConversionResult r = e.getValue();
            if (r.success()) {
                out.println(e.getKey().label() + ": " + r.resultExpression());
            } else {
                out.println(e.getKey().label() + ": error: " + r.errorMessage());
                ok = false;
            }
            List<String> steps = r.steps();
            for (String step : steps) {
                out.println("    " + step);
            }
        }
        return ok;
    }
}
