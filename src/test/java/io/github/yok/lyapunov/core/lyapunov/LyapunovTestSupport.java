package io.github.yok.lyapunov.core.lyapunov;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.NormOps_DDRM;

/**
 * Lyapunov ソルバのテストで共通に使う検証ヘルパです。
 */
final class LyapunovTestSupport {

    private LyapunovTestSupport() {
    }

    /**
     * 2 つの行列の全成分が絶対誤差 tol 以内で一致することを検証します。
     */
    static void assertMatrixClose(DMatrixRMaj actual, DMatrixRMaj expected, double tol) {
        assertThat(actual.numRows).isEqualTo(expected.numRows);
        assertThat(actual.numCols).isEqualTo(expected.numCols);
        for (int i = 0; i < expected.numRows; i++) {
            for (int j = 0; j < expected.numCols; j++) {
                assertThat(actual.get(i, j)).as("(%s, %s)", i, j).isCloseTo(expected.get(i, j),
                        within(tol));
            }
        }
    }

    /**
     * X が対称で、{@code A^T X + X A = -Q} を満たすことを検証します。
     *
     * @param relativeTol 残差の許容誤差（||Q||_F に対する相対値）です
     */
    static void assertSolvesLyapunov(DMatrixRMaj a, DMatrixRMaj q, DMatrixRMaj x,
            double relativeTol) {
        assertMatrixClose(x, CommonOps_DDRM.transpose(x, null), relativeTol);

        DMatrixRMaj lhs = new DMatrixRMaj(a.numRows, a.numCols);
        DMatrixRMaj work = new DMatrixRMaj(a.numRows, a.numCols);
        CommonOps_DDRM.multTransA(a, x, lhs);
        CommonOps_DDRM.mult(x, a, work);
        CommonOps_DDRM.addEquals(lhs, work);

        DMatrixRMaj minusQ = q.copy();
        CommonOps_DDRM.changeSign(minusQ);
        assertMatrixClose(lhs, minusQ, relativeTol * Math.max(NormOps_DDRM.normF(q), 1.0));
    }

    /**
     * 行優先の 2 次元配列から行列を作ります。
     */
    static DMatrixRMaj matrix(double[][] data) {
        return new DMatrixRMaj(data);
    }
}
