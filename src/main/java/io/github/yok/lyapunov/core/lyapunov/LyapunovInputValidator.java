package io.github.yok.lyapunov.core.lyapunov;

import com.google.common.base.Preconditions;
import org.ejml.data.DMatrixRMaj;

/**
 * Lyapunov 方程式の入力（A, Q）の形状を検証するクラスです。
 *
 * <p>
 * 数値計算の前に実行し、A と Q が同じ次元の正方行列であることを確認します。 Q の対称性は呼び出し側の責務として検証しません。
 * </p>
 */
public final class LyapunovInputValidator {

    /**
     * A と Q を検証します。
     *
     * @param a 係数行列 A です
     * @param q 右辺行列 Q です
     * @throws IllegalArgumentException null、正方でない、空、次元不一致、または有限値でない成分を含む場合に発生します
     */
    public void validate(DMatrixRMaj a, DMatrixRMaj q) {
        Preconditions.checkArgument(a != null, "A は null 不可です");
        Preconditions.checkArgument(q != null, "Q は null 不可です");
        Preconditions.checkArgument(a.numRows == a.numCols, "A は正方行列が必要です: %sx%s",
                a.numRows, a.numCols);
        Preconditions.checkArgument(q.numRows == q.numCols, "Q は正方行列が必要です: %sx%s",
                q.numRows, q.numCols);
        Preconditions.checkArgument(a.numRows == q.numRows,
                "A と Q の次元が一致しません: A=%sx%s, Q=%sx%s", a.numRows, a.numCols, q.numRows,
                q.numCols);
        Preconditions.checkArgument(a.numRows > 0, "A と Q は 1×1 以上が必要です");

        ensureFinite(a, "A");
        ensureFinite(q, "Q");
    }

    /**
     * 全成分が有限値であることを確認します。
     *
     * @param m 行列です
     * @param name メッセージに含める行列名です
     * @throws IllegalArgumentException NaN または無限大を含む場合に発生します
     */
    private static void ensureFinite(DMatrixRMaj m, String name) {
        for (int i = 0; i < m.numRows; i++) {
            for (int j = 0; j < m.numCols; j++) {
                double v = m.get(i, j);
                Preconditions.checkArgument(Double.isFinite(v), "%s は有限値が必要です: (%s, %s)=%s",
                        name, i, j, v);
            }
        }
    }
}
