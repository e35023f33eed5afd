package io.github.yok.lyapunov.core.lyapunov;

import com.google.common.base.Preconditions;
import lombok.Value;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.NormOps_DDRM;

/**
 * 求めた解 X の品質（対称性の崩れと方程式の残差）を表すクラスです。
 *
 * <ul>
 * <li>対称性の崩れ: {@code ||X - X^T||_F}</li>
 * <li>残差: {@code ||A^T X + X A + Q||_F}</li>
 * <li>相対残差: {@code 残差 / max(||Q||_F, 最小正規化数)}</li>
 * </ul>
 */
@Value
public class LyapunovResidual {

    /**
     * {@code ||X - X^T||_F} です。
     */
    double symmetryDefect;

    /**
     * {@code ||A^T X + X A + Q||_F} です。
     */
    double residualNorm;

    /**
     * Q のノルムで割った残差です。
     */
    double relativeResidual;

    /**
     * A, Q, X から残差を計算します。
     *
     * @param a 係数行列 A です
     * @param q 右辺行列 Q です
     * @param x 解 X です
     * @return 残差です
     * @throws IllegalArgumentException 次元が不整合の場合に発生します
     */
    public static LyapunovResidual of(DMatrixRMaj a, DMatrixRMaj q, DMatrixRMaj x) {
        Preconditions.checkArgument(a != null && q != null && x != null,
                "A, Q, X は null 不可です");
        int n = a.numRows;
        Preconditions.checkArgument(a.numCols == n && q.numRows == n && q.numCols == n
                && x.numRows == n && x.numCols == n, "A, Q, X は同じ次元の正方行列が必要です");

        DMatrixRMaj xt = CommonOps_DDRM.transpose(x, null);
        DMatrixRMaj diff = new DMatrixRMaj(n, n);
        CommonOps_DDRM.subtract(x, xt, diff);
        double symmetryDefect = NormOps_DDRM.normF(diff);

        // A^T X + X A + Q
        DMatrixRMaj r = new DMatrixRMaj(n, n);
        DMatrixRMaj work = new DMatrixRMaj(n, n);
        CommonOps_DDRM.multTransA(a, x, r);
        CommonOps_DDRM.mult(x, a, work);
        CommonOps_DDRM.addEquals(r, work);
        CommonOps_DDRM.addEquals(r, q);
        double residualNorm = NormOps_DDRM.normF(r);

        double qNorm = Math.max(NormOps_DDRM.normF(q), Double.MIN_NORMAL);
        return new LyapunovResidual(symmetryDefect, residualNorm, residualNorm / qNorm);
    }
}
