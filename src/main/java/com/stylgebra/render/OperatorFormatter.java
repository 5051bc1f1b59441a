package com.stylgebra.render;

import com.stylgebra.error.InvalidStyleException;
import com.stylgebra.node.Node;
import com.stylgebra.style.Form;
import com.stylgebra.style.Modifier;
import com.stylgebra.style.Style;
import com.stylgebra.text.Brackets;
import com.stylgebra.text.Text;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.regex.Pattern;

/**
 * Arithmetic: summands, sums, products, quotients and powers.
 *
 * <p>Every operator forwards all of its operands before looking at its own form, so the
 * variables inside take on their values even when only the name or value is written.
 */
class OperatorFormatter {
    private static final Pattern NUMERAL = Pattern.compile("\\s*[+-]?\\d+\\s*");

    private static final Modifier ROUND_BRACKETS = Modifier.merge("brackets", Brackets.ROUND);
    private static final Modifier CENTERED_DOTS = Modifier.merge("style", "c");

    Text summand(Node.Summand s, Frame frame) {
        Text t = frame.forward(s.term(), "term");
        return s.sign() == -1 ? t.negated() : t;
    }

    /**
     * Options: {@code form} [symbolic], {@code brackets} [none], {@code show-zeros} [false],
     * {@code flip-ops} [true]. Terms render under {@code term0}, {@code term1}, ...; a term
     * that is itself a sum is bracketed and an ellipsis is centered.
     */
    Text sum(Node.Sum sum, Frame frame) {
        MutableList<Text> terms = Lists.mutable.empty();
        for (int i = 0; i < sum.summands().size(); i++) {
            Node term = sum.summands().get(i).term();
            terms.add(frame.forward(term, "term" + i, operandModifier(term, false)));
        }

        Style.Options o = frame.options();
        Form form = Form.of(o, Form.SYMBOLIC);
        if (form == Form.NAME) {
            return frame.name();
        }
        if (form == Form.VALUE) {
            return Text.math(Values.display(frame.valueOf(sum)));
        }

        boolean showZeros = o.getBoolean("show-zeros", false);
        boolean flipOps = o.getBoolean("flip-ops", true);

        Text s = Text.EMPTY;
        boolean first = true;
        boolean multipleTerms = false;
        for (int i = 0; i < terms.size(); i++) {
            Text f = terms.get(i);
            int sign = sum.summands().get(i).sign();

            if (f.isZero() && !showZeros) {
                continue;
            }

            if (first) {
                first = false;
                s = sign == -1 ? f.negated() : f;
            } else {
                if (f.startsWith("-") && flipOps) {
                    sign = -sign;
                    f = Text.math(f.dropFirst());
                }
                s = s.plus(Text.math(" " + (sign == -1 ? "-" : "+") + " " + f.content()));
                multipleTerms = true;
            }
        }

        if (s.isEmpty()) {
            s = Text.math("0");
        }

        String bracketStyle = o.getString("brackets", Brackets.NONE);
        if (multipleTerms && !bracketStyle.equals(Brackets.NONE)) {
            s = Brackets.wrap(bracketStyle, s);
        }
        return Text.math(s);
    }

    /**
     * Options: {@code form} [symbolic], {@code brackets} [none], {@code collapse-zero} [true],
     * {@code mult-symb} ({@code none|dot|x|paren}) [none], {@code numerals}
     * ({@code front-dot|dot|none}) [front-dot], {@code show-unity} [false], {@code signs}
     * ({@code gather|bracket|auto}) [gather].
     *
     * <p>A numeral is a factor whose rendering parses as an integer.
     */
    Text product(Node.Product product, Frame frame) {
        MutableList<Text> factors = Lists.mutable.empty();
        for (int i = 0; i < product.factors().size(); i++) {
            Node factor = product.factors().get(i);
            factors.add(frame.forward(factor, "factor" + i, operandModifier(factor, true)));
        }

        Style.Options o = frame.options();
        Form form = Form.of(o, Form.SYMBOLIC);
        if (form == Form.NAME) {
            return frame.name();
        }
        if (form == Form.VALUE) {
            return Text.math(Values.display(frame.valueOf(product)));
        }

        String multSymbRule = o.getString("mult-symb", "none");
        String multSymbol = switch (multSymbRule) {
            case "none" -> " ";
            case "dot" -> " \\cdot ";
            case "x" -> " \\times ";
            case "paren" -> ")(";
            default -> throw new InvalidStyleException("mult-symb", multSymbRule);
        };

        boolean collapseZero = o.getBoolean("collapse-zero", true);
        boolean showUnity = o.getBoolean("show-unity", false);

        String signRule = o.getString("signs", "gather");
        boolean gatherSigns = signRule.equals("gather");
        boolean bracketSigns = signRule.equals("bracket") || (signRule.equals("auto") && multSymbol.equals(" "));

        String numeralRule = o.getString("numerals", "front-dot");
        boolean gatherNumerals = numeralRule.equals("front-dot");
        boolean dotNumerals = multSymbRule.equals("none") && numeralRule.endsWith("dot");

        MutableList<Text> pruned = Lists.mutable.empty();
        MutableList<Text> numerals = Lists.mutable.empty();
        int numNeg = 0;
        int numNumerals = 0;
        int numFactors = 0;
        Text result = null;
        for (Text f : factors) {
            Text s = f;
            boolean needsBrackets = false;

            if (s.isZero() && collapseZero) {
                result = Text.math("0");
                break;
            }

            if (s.startsWith("-")) {
                if (gatherSigns) {
                    numNeg++;
                    s = Text.math(s.dropFirst());
                } else if (bracketSigns) {
                    needsBrackets = true;
                }
            }

            if (!s.is("1") || showUnity) {
                boolean numeral = (gatherNumerals || dotNumerals) && NUMERAL.matcher(s.content()).matches();

                if (dotNumerals && numeral && (numNumerals > 0 || (numFactors > 0 && !gatherNumerals))) {
                    s = Text.math("\\cdot ").plus(s);
                    needsBrackets = false;
                }

                if (needsBrackets) {
                    s = Text.math("(").plus(s).plusMath(")");
                }

                if (gatherNumerals && numeral) {
                    numerals.add(s);
                    numNumerals++;
                } else {
                    pruned.add(s);
                }

                numFactors++;
            }
        }

        if (result == null) {
            if (gatherNumerals) {
                pruned = numerals.withAll(pruned);
            }
            Text sign = numNeg % 2 == 1 ? Text.math("-") : Text.EMPTY;
            Text term = numFactors == 0 ? Text.math("1") : Text.join(Text.math(multSymbol), pruned);
            if (multSymbol.equals(")(")) {
                term = Text.math("(").plus(term).plusMath(")");
            }
            result = sign.plus(term);
        }

        result = Brackets.wrap(o.getString("brackets", Brackets.NONE), result);
        return Text.math(result);
    }

    /**
     * Options: {@code form} [symbolic], {@code inline} [false], {@code brackets-top},
     * {@code brackets-bot} [none], {@code collapse-zero}, {@code sign-front},
     * {@code collapse-int} [true].
     */
    Text quotient(Node.Quotient q, Frame frame) {
        Text t = frame.forward(q.top(), "top");
        Text b = frame.forward(q.bottom(), "bot");

        Style.Options o = frame.options();
        Form form = Form.of(o, Form.SYMBOLIC);
        if (form == Form.NAME) {
            return frame.name();
        }
        if (form == Form.VALUE) {
            return Text.math(Values.display(frame.valueOf(q)));
        }

        if (t.isZero() && o.getBoolean("collapse-zero", true)) {
            return Text.math("0");
        }

        int numNeg = 0;
        if (o.getBoolean("sign-front", true)) {
            if (t.startsWith("-")) {
                numNeg++;
                t = Text.math(t.dropFirst());
            }
            if (b.startsWith("-")) {
                numNeg++;
                b = Text.math(b.dropFirst());
            }
        }

        t = Brackets.wrap(o.getString("brackets-top", Brackets.NONE), t);
        b = Brackets.wrap(o.getString("brackets-bot", Brackets.NONE), b);

        String quotient;
        if (b.is("1") && o.getBoolean("collapse-int", true)) {
            quotient = t.content();
        } else if (o.getBoolean("inline", false)) {
            quotient = t.content() + "/" + b.content();
        } else {
            quotient = "\\frac{" + t.content() + "}{" + b.content() + "}";
        }

        if (numNeg == 1) {
            quotient = "-" + quotient;
        }
        return Text.math(quotient);
    }

    /**
     * Options: {@code form} [symbolic], {@code show-zero}, {@code show-unity} [false],
     * {@code negative} ({@code sup|frac|inline|inline-paren}) [sup], {@code brackets-base},
     * {@code brackets-power} [auto].
     */
    Text power(Node.Power power, Frame frame) {
        Text b = frame.forward(power.base(), "base");
        Text p = frame.forward(power.exponent(), "power");

        Style.Options o = frame.options();
        Form form = Form.of(o, Form.SYMBOLIC);
        if (form == Form.NAME) {
            return frame.name();
        }
        if (form == Form.VALUE) {
            return Text.math(Values.display(frame.valueOf(power)));
        }

        String outerForm = "%s";
        String negativePolicy = o.getString("negative", "sup");
        if (p.startsWith("-") && !negativePolicy.equals("sup")) {
            outerForm = switch (negativePolicy) {
                case "frac" -> "\\frac{1}{%s}";
                case "inline" -> "1/%s";
                case "inline-paren" -> "1/\\left(%s\\right)";
                default -> outerForm;
            };
            p = p.negated();
        }

        boolean showZero = o.getBoolean("show-zero", false);
        boolean showUnity = o.getBoolean("show-unity", false);

        String baseBrackets = o.getString("brackets-base", Brackets.AUTO);
        String powerBrackets = o.getString("brackets-power", Brackets.AUTO);

        if (baseBrackets.equals(Brackets.AUTO)) {
            boolean unityHidden = p.is("1") && !showUnity;
            boolean compound = isProperSum(power.base()) || power.base() instanceof Node.Quotient;
            baseBrackets = !unityHidden && compound ? Brackets.ROUND : Brackets.NONE;
        }
        if (powerBrackets.equals(Brackets.AUTO)) {
            powerBrackets = isProperSum(power.exponent()) ? Brackets.ROUND : Brackets.NONE;
        }

        b = Brackets.wrap(baseBrackets, b);
        p = Brackets.wrap(powerBrackets, p);

        if (p.is("0") && !showZero) {
            return Text.math("1");
        }
        if (p.is("1") && !showUnity) {
            return Text.math(String.format(outerForm, b.content()));
        }
        return Text.math(String.format(outerForm, b.content() + "^{" + p.content() + "}"));
    }

    static boolean isProperSum(Node node) {
        return node instanceof Node.Sum s && s.summands().size() >= 2;
    }

    private static Modifier operandModifier(Node operand, boolean bracketProducts) {
        if (operand instanceof Node.Sum || (bracketProducts && operand instanceof Node.Product)) {
            return ROUND_BRACKETS;
        }
        if (operand instanceof Node.Ellipsis) {
            return CENTERED_DOTS;
        }
        return null;
    }
}
