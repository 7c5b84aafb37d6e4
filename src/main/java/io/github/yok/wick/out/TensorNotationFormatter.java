package io.github.yok.wick.out;

import io.github.yok.wick.core.algebra.Delta;
import io.github.yok.wick.core.algebra.Operator;
import io.github.yok.wick.core.algebra.Statistics;
import io.github.yok.wick.core.algebra.Term;
import io.github.yok.wick.core.algebra.TermSum;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 項と和を LaTeX 風のテンソル表記に整形するクラスです。
 *
 * <p>
 * 例: {@code 2a^{p1}_{p2}}、{@code -s^{p3}_{p1}s^{p4}_{p2}}。 コアの計算には関与せず、和が公開する項の情報のみを使用します。
 * </p>
 */
public final class TensorNotationFormatter {

    /**
     * 演算子を LaTeX 表記にします（生成は上付き、消滅は下付き）。
     *
     * @param op 演算子です
     * @param statistics 統計性です
     * @return LaTeX 表記です（例: {@code a^{p1}}）
     */
    public String formatOperator(Operator op, Statistics statistics) {
        String elem = statistics == Statistics.FERMI_DIRAC ? "a" : "b";
        String script = op.isCreate() ? "^" : "_";
        return elem + script + "{" + op.getIndex().alphanumericName() + "}";
    }

    /**
     * デルタを LaTeX 表記にします。両添字が同一の場合は空文字です。
     *
     * @param delta デルタです
     * @return LaTeX 表記です（例: {@code s^{p3}_{p1}}）
     */
    public String formatDelta(Delta delta) {
        if (delta.isTrivial()) {
            return "";
        }
        return "s^{" + delta.getA().alphanumericName() + "}_{" + delta.getB().alphanumericName()
                + "}";
    }

    /**
     * 項を演算子列の順序どおりに LaTeX 表記にします。
     *
     * @param term 項です
     * @return LaTeX 表記です
     */
    public String formatLatex(Term term) {
        StringBuilder sb = new StringBuilder();
        appendCoefficient(sb, term);
        for (Delta d : term.getDeltas()) {
            sb.append(formatDelta(d));
        }
        for (Operator op : term.getOperators()) {
            sb.append(formatOperator(op, term.getStatistics()));
        }
        return sb.toString();
    }

    /**
     * 項をテンソル表記にします。
     *
     * <p>
     * 正規順序の項は生成演算子の添字を上付きに、消滅演算子の添字を逆順で下付きにまとめます（例: {@code a^{p1p2}_{p4p3}}）。
     * 正規順序でない項は {@link #formatLatex(Term)} と同じです。
     * </p>
     *
     * @param term 項です
     * @return テンソル表記です
     */
    public String formatTensor(Term term) {
        if (!term.isNormalOrder()) {
            return formatLatex(term);
        }
        StringBuilder sb = new StringBuilder();
        appendCoefficient(sb, term);
        for (Delta d : term.getDeltas()) {
            sb.append(formatDelta(d));
        }

        List<String> ups = new ArrayList<>();
        List<String> downs = new ArrayList<>();
        for (Operator op : term.getOperators()) {
            if (op.isCreate()) {
                ups.add(op.getIndex().alphanumericName());
            } else {
                downs.add(0, op.getIndex().alphanumericName());
            }
        }
        if (!ups.isEmpty() || !downs.isEmpty()) {
            sb.append(term.getStatistics().symbol());
            if (!ups.isEmpty()) {
                sb.append("^{").append(String.join("", ups)).append("}");
            }
            if (!downs.isEmpty()) {
                sb.append("_{").append(String.join("", downs)).append("}");
            }
        }
        return sb.toString();
    }

    /**
     * 和をテンソル表記にします。空の和は {@code 0} です。
     *
     * @param sum 和です
     * @return テンソル表記です（例: {@code -s^{p3}_{p1}s^{p4}_{p2} + s^{p3}_{p2}s^{p4}_{p1}}）
     */
    public String format(TermSum sum) {
        StringBuilder sb = new StringBuilder();
        for (Term term : sum) {
            String tex = formatTensor(term);
            if (tex.isEmpty() || "0".equals(tex)) {
                continue;
            }
            if (sb.length() == 0) {
                sb.append(tex);
            } else if (tex.startsWith("-")) {
                sb.append(" - ").append(tex.substring(1));
            } else {
                sb.append(" + ").append(tex);
            }
        }
        return sb.length() == 0 ? "0" : sb.toString();
    }

    /**
     * 係数を数値文字列にします（末尾の 0 と小数点は取り除きます）。
     *
     * @param coefficient 係数です
     * @return 数値文字列です（例: 2.0 → 2、0.50 → 0.5）
     */
    public String formatCoefficient(double coefficient) {
        return BigDecimal.valueOf(coefficient).stripTrailingZeros().toPlainString();
    }

    /**
     * 係数部分を追記します。1 は省略（表記される因子が無い項のみ 1 を出力）、-1 は符号のみです。
     *
     * @param sb 追記先バッファです
     * @param term 項です
     */
    private void appendCoefficient(StringBuilder sb, Term term) {
        double c = term.getCoefficient();
        boolean bare = !hasVisibleFactor(term);
        if (c == 1.0) {
            if (bare) {
                sb.append("1");
            }
        } else if (c == -1.0) {
            sb.append(bare ? "-1" : "-");
        } else {
            sb.append(formatCoefficient(c));
        }
    }

    /**
     * 係数以外に表記される因子（演算子、または自明でないデルタ）があるかを返します。
     *
     * @param term 項です
     * @return 表記される因子がある場合は true です
     */
    private static boolean hasVisibleFactor(Term term) {
        if (!term.getOperators().isEmpty()) {
            return true;
        }
        for (Delta d : term.getDeltas()) {
            if (!d.isTrivial()) {
                return true;
            }
        }
        return false;
    }
}
