package io.github.yok.lyapunov.core.lyapunov;

import com.google.common.base.Preconditions;
import java.util.Locale;
import org.ejml.data.Complex_F64;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.NormOps_DDRM;

/**
 * 準上三角化した Lyapunov 方程式の小ブロック（1×1, 2×2）を解く閉形式カーネル群です。
 *
 * <p>
 * いずれも {@code A^T X + X A = -Q}（対角ブロック）または {@code Tii^T X + X Tjj = -R}（非対角ブロック）を解きます。 解く前に、対象ブロックの固有値の和が閾値未満になる組がないかを検査し、
 * 見つかった場合は {@link SingularLyapunovEquationException} を投げます。
 * </p>
 */
public final class LyapunovKernels {

    /**
     * 既定の相対許容誤差です（約 {@code 4.5e5 * ε}）。
     *
     * <p>
     * 閾値（絶対値）は {@code 相対許容誤差 * ||A||_F} で決めます。A が零行列の場合は {@link Double#MIN_NORMAL} です。
     * </p>
     */
    public static final double DEFAULT_RELATIVE_TOLERANCE = 1e-10;

    private LyapunovKernels() {
    }

    /**
     * 相対許容誤差と行列から、絶対値の閾値を計算します。
     *
     * @param relativeTolerance 相対許容誤差です
     * @param a 基準にする行列です
     * @return 閾値です（A を c 倍すると閾値も c 倍になります）
     */
    public static double threshold(double relativeTolerance, DMatrixRMaj a) {
        // 零行列でも |λ+μ| = 0 を特異と判定できるよう、正の下限を設けます。
        return Math.max(relativeTolerance * NormOps_DDRM.normF(a), Double.MIN_NORMAL);
    }

    /**
     * 1×1 の Lyapunov 方程式 {@code 2 a x = -q} を既定の閾値で解きます。
     *
     * @param a 1×1 行列です
     * @param q 1×1 行列です
     * @return 解 x（1×1）です
     * @throws IllegalArgumentException サイズが 1×1 でない場合に発生します
     * @throws SingularLyapunovEquationException {@code |2a|} が閾値未満の場合に発生します
     */
    public static DMatrixRMaj solve1By1(DMatrixRMaj a, DMatrixRMaj q) {
        checkSize(a, 1, "a");
        return solve1By1(a, q, threshold(DEFAULT_RELATIVE_TOLERANCE, a));
    }

    /**
     * 1×1 の Lyapunov 方程式 {@code 2 a x = -q} を解きます。
     *
     * @param a 1×1 行列です
     * @param q 1×1 行列です
     * @param threshold 固有値和の判定に用いる閾値（絶対値）です
     * @return 解 x（1×1）です
     * @throws IllegalArgumentException サイズが 1×1 でない場合に発生します
     * @throws SingularLyapunovEquationException {@code |2a|} が閾値未満の場合に発生します
     */
    public static DMatrixRMaj solve1By1(DMatrixRMaj a, DMatrixRMaj q, double threshold) {
        checkSize(a, 1, "a");
        checkSize(q, 1, "q");

        double twoA = 2.0 * a.get(0, 0);
        if (Math.abs(twoA) < threshold) {
            Complex_F64 lambda = new Complex_F64(a.get(0, 0), 0.0);
            throw new SingularLyapunovEquationException(
                    "固有値が 0 に近いため解が一意に定まりません: λ=" + format(lambda) + "、閾値="
                            + format(threshold),
                    lambda, lambda, threshold);
        }

        DMatrixRMaj x = new DMatrixRMaj(1, 1);
        x.set(0, 0, -q.get(0, 0) / twoA);
        return x;
    }

    /**
     * 2×2 の Lyapunov 方程式 {@code A^T X + X A = -Q} を既定の閾値で解きます。
     *
     * @param a 2×2 行列です
     * @param q 2×2 対称行列です（上三角のみ参照します）
     * @return 解 X（2×2 対称）です
     * @throws IllegalArgumentException サイズが 2×2 でない場合に発生します
     * @throws SingularLyapunovEquationException 固有値の和が閾値未満の組がある場合に発生します
     */
    public static DMatrixRMaj solve2By2(DMatrixRMaj a, DMatrixRMaj q) {
        checkSize(a, 2, "a");
        return solve2By2(a, q, threshold(DEFAULT_RELATIVE_TOLERANCE, a));
    }

    /**
     * 2×2 の Lyapunov 方程式 {@code A^T X + X A = -Q} を解きます。
     *
     * <p>
     * {@code A = [[a, b], [c, d]]}、{@code X = [[x11, x12], [x12, x22]]} として成分ごとに展開した 3×3 連立方程式
     * </p>
     *
     * <pre>
     *   [2a   2c   0 ] [x11]     [q11]
     *   [ b  a+d   c ] [x12] = - [q12]
     *   [ 0   2b  2d ] [x22]     [q22]
     * </pre>
     *
     * <p>
     * を解きます。係数行列の行列式は {@code 4 (a+d)(ad-bc)} で、固有値の和 {@code 2λ1, λ1+λ2, 2λ2} の積に等しくなります。
     * </p>
     *
     * @param a 2×2 行列です
     * @param q 2×2 対称行列です（上三角のみ参照します）
     * @param threshold 固有値和の判定に用いる閾値（絶対値）です
     * @return 解 X（2×2 対称）です
     * @throws IllegalArgumentException サイズが 2×2 でない場合に発生します
     * @throws SingularLyapunovEquationException 固有値の和が閾値未満の組がある場合に発生します
     */
    public static DMatrixRMaj solve2By2(DMatrixRMaj a, DMatrixRMaj q, double threshold) {
        checkSize(a, 2, "a");
        checkSize(q, 2, "q");

        Complex_F64[] lambda = eigenvalues(a);
        ensureEigenvalueSumsAwayFromZero(lambda, lambda, threshold, "2×2 対角ブロック");

        double a11 = a.get(0, 0);
        double a12 = a.get(0, 1);
        double a21 = a.get(1, 0);
        double a22 = a.get(1, 1);

        DMatrixRMaj m = new DMatrixRMaj(new double[][] {
                {2.0 * a11, 2.0 * a21, 0.0},
                {a12, a11 + a22, a21},
                {0.0, 2.0 * a12, 2.0 * a22}});
        DMatrixRMaj rhs = new DMatrixRMaj(new double[][] {
                {-q.get(0, 0)},
                {-q.get(0, 1)},
                {-q.get(1, 1)}});
        DMatrixRMaj u = new DMatrixRMaj(3, 1);

        if (!CommonOps_DDRM.solve(m, rhs, u)) {
            throw new SingularLyapunovEquationException(
                    "2×2 対角ブロックの連立方程式が特異です: λ1=" + format(lambda[0]) + "、λ2="
                            + format(lambda[1]),
                    lambda[0], lambda[1], threshold);
        }

        DMatrixRMaj x = new DMatrixRMaj(2, 2);
        x.set(0, 0, u.get(0, 0));
        x.set(0, 1, u.get(1, 0));
        x.set(1, 0, u.get(1, 0));
        x.set(1, 1, u.get(2, 0));
        return x;
    }

    /**
     * 非対角ブロックの方程式 {@code Tii^T Y + Y Tjj = -R} を解きます。
     *
     * <p>
     * Y を列優先で並べたベクトルに対する {@code (I ⊗ Tii^T + Tjj^T ⊗ I) vec(Y) = -vec(R)}（最大 4×4）を組み立てて解きます。
     * </p>
     *
     * @param tii 行側の対角ブロック（p×p、p は 1 または 2）です
     * @param tjj 列側の対角ブロック（q×q、q は 1 または 2）です
     * @param r 右辺ブロック（p×q）です
     * @param threshold 固有値和の判定に用いる閾値（絶対値）です
     * @return 解 Y（p×q）です
     * @throws IllegalArgumentException サイズが不整合の場合に発生します
     * @throws SingularLyapunovEquationException {@code λ ∈ σ(Tii)}, {@code μ ∈ σ(Tjj)} の和が閾値未満の組がある場合に発生します
     */
    public static DMatrixRMaj solveCoupledBlock(DMatrixRMaj tii, DMatrixRMaj tjj, DMatrixRMaj r,
            double threshold) {
        int p = tii.numRows;
        int q = tjj.numRows;
        Preconditions.checkArgument(p == 1 || p == 2, "tii は 1×1 または 2×2 が必要です: %sx%s",
                tii.numRows, tii.numCols);
        Preconditions.checkArgument(q == 1 || q == 2, "tjj は 1×1 または 2×2 が必要です: %sx%s",
                tjj.numRows, tjj.numCols);
        checkSize(tii, p, "tii");
        checkSize(tjj, q, "tjj");
        Preconditions.checkArgument(r.numRows == p && r.numCols == q,
                "r のサイズが不整合です: %sx%s（期待値 %sx%s）", r.numRows, r.numCols, p, q);

        ensureEigenvalueSumsAwayFromZero(eigenvalues(tii), eigenvalues(tjj), threshold,
                "非対角ブロック");

        if (p == 1 && q == 1) {
            DMatrixRMaj y = new DMatrixRMaj(1, 1);
            y.set(0, 0, -r.get(0, 0) / (tii.get(0, 0) + tjj.get(0, 0)));
            return y;
        }

        int size = p * q;
        DMatrixRMaj k = new DMatrixRMaj(size, size);
        DMatrixRMaj rhs = new DMatrixRMaj(size, 1);

        for (int col = 0; col < q; col++) {
            for (int row = 0; row < p; row++) {
                int e = col * p + row;

                // (Tii^T Y)(row, col) = Σ_s Tii(s, row) Y(s, col)
                for (int s = 0; s < p; s++) {
                    k.add(e, col * p + s, tii.get(s, row));
                }
                // (Y Tjj)(row, col) = Σ_s Y(row, s) Tjj(s, col)
                for (int s = 0; s < q; s++) {
                    k.add(e, s * p + row, tjj.get(s, col));
                }
                rhs.set(e, 0, -r.get(row, col));
            }
        }

        DMatrixRMaj vec = new DMatrixRMaj(size, 1);
        if (!CommonOps_DDRM.solve(k, rhs, vec)) {
            throw new SingularLyapunovEquationException("非対角ブロックの連立方程式が特異です",
                    eigenvalues(tii)[0], eigenvalues(tjj)[0], threshold);
        }

        DMatrixRMaj y = new DMatrixRMaj(p, q);
        for (int col = 0; col < q; col++) {
            for (int row = 0; row < p; row++) {
                y.set(row, col, vec.get(col * p + row, 0));
            }
        }
        return y;
    }

    /**
     * 1×1 または 2×2 ブロックの固有値を閉形式で計算します。
     *
     * <p>
     * 2×2 ブロック {@code [[a, b], [c, d]]} の固有値は {@code (a+d)/2 ± sqrt(((a-d)/2)^2 + bc)} です。
     * </p>
     *
     * @param block 1×1 または 2×2 の行列です
     * @return 固有値の配列（長さはブロックサイズ）です
     * @throws IllegalArgumentException サイズが 1×1, 2×2 以外の場合に発生します
     */
    public static Complex_F64[] eigenvalues(DMatrixRMaj block) {
        Preconditions.checkArgument(
                block.numRows == block.numCols && (block.numRows == 1 || block.numRows == 2),
                "ブロックは 1×1 または 2×2 が必要です: %sx%s", block.numRows, block.numCols);

        if (block.numRows == 1) {
            return new Complex_F64[] {new Complex_F64(block.get(0, 0), 0.0)};
        }

        double a = block.get(0, 0);
        double b = block.get(0, 1);
        double c = block.get(1, 0);
        double d = block.get(1, 1);

        double mean = 0.5 * (a + d);
        double half = 0.5 * (a - d);
        double disc = half * half + b * c;

        if (disc >= 0.0) {
            double root = Math.sqrt(disc);
            return new Complex_F64[] {new Complex_F64(mean + root, 0.0),
                    new Complex_F64(mean - root, 0.0)};
        }
        double im = Math.sqrt(-disc);
        return new Complex_F64[] {new Complex_F64(mean, im), new Complex_F64(mean, -im)};
    }

    /**
     * 2 つの固有値集合の全ての組について、和の絶対値が閾値以上であることを確認します。
     *
     * @param left 左側の固有値です
     * @param right 右側の固有値です
     * @param threshold 閾値（絶対値）です
     * @param context メッセージに含める対象ブロックの説明です
     * @throws SingularLyapunovEquationException 和の絶対値が閾値未満の組がある場合に発生します
     */
    private static void ensureEigenvalueSumsAwayFromZero(Complex_F64[] left, Complex_F64[] right,
            double threshold, String context) {
        for (Complex_F64 l : left) {
            for (Complex_F64 r : right) {
                double sum = Math.hypot(l.real + r.real, l.imaginary + r.imaginary);
                if (sum < threshold) {
                    throw new SingularLyapunovEquationException(
                            context + "で固有値の和が 0 に近いため解が一意に定まりません: λ=" + format(l) + "、μ="
                                    + format(r) + "、|λ+μ|=" + format(sum) + "、閾値="
                                    + format(threshold),
                            l, r, threshold);
                }
            }
        }
    }

    /**
     * 行列が size×size であることを確認します。
     *
     * @param m 行列です
     * @param size 期待するサイズです
     * @param name メッセージに含める引数名です
     * @throws IllegalArgumentException null またはサイズ不整合の場合に発生します
     */
    private static void checkSize(DMatrixRMaj m, int size, String name) {
        Preconditions.checkArgument(m != null, "%s は null 不可です", name);
        Preconditions.checkArgument(m.numRows == size && m.numCols == size,
                "%s は %s×%s が必要です: %sx%s", name, size, size, m.numRows, m.numCols);
    }

    /**
     * 数値を指数表記の文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String format(double v) {
        return String.format(Locale.ROOT, "%.5e", v);
    }

    /**
     * 複素数を文字列に整形します。
     *
     * @param c 複素数です
     * @return 整形した文字列です
     */
    private static String format(Complex_F64 c) {
        if (c.imaginary == 0.0) {
            return format(c.real);
        }
        return format(c.real) + (c.imaginary < 0 ? "-" : "+") + format(Math.abs(c.imaginary)) + "i";
    }
}
