package io.github.yok.lyapunov.core.lyapunov;

import static io.github.yok.lyapunov.core.lyapunov.LyapunovTestSupport.matrix;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.junit.jupiter.api.Test;

class LyapunovResidualTest {

    @Test
    void exactSolutionHasZeroResidual() {
        DMatrixRMaj a = matrix(new double[][] {{-1, 0}, {0, -2}});
        DMatrixRMaj q = matrix(new double[][] {{2, 0}, {0, 4}});

        LyapunovResidual residual = LyapunovResidual.of(a, q, CommonOps_DDRM.identity(2));

        assertThat(residual.getSymmetryDefect()).isZero();
        assertThat(residual.getResidualNorm()).isZero();
        assertThat(residual.getRelativeResidual()).isZero();
    }

    @Test
    void measuresResidualRelativeToRightHandSide() {
        DMatrixRMaj a = matrix(new double[][] {{-1}});
        DMatrixRMaj q = matrix(new double[][] {{2}});

        // -2 - 2 + 2 = -2
        LyapunovResidual residual = LyapunovResidual.of(a, q, matrix(new double[][] {{2}}));

        assertThat(residual.getResidualNorm()).isCloseTo(2.0, within(1e-15));
        assertThat(residual.getRelativeResidual()).isCloseTo(1.0, within(1e-15));
    }

    @Test
    void measuresAsymmetryOfSolution() {
        DMatrixRMaj x = matrix(new double[][] {{1, 2}, {0, 1}});

        LyapunovResidual residual =
                LyapunovResidual.of(CommonOps_DDRM.identity(2), new DMatrixRMaj(2, 2), x);

        assertThat(residual.getSymmetryDefect()).isCloseTo(Math.sqrt(8.0), within(1e-15));
    }

    @Test
    void zeroRightHandSideDoesNotDivideByZero() {
        DMatrixRMaj a = matrix(new double[][] {{-1}});

        LyapunovResidual residual =
                LyapunovResidual.of(a, new DMatrixRMaj(1, 1), matrix(new double[][] {{1}}));

        assertThat(residual.getRelativeResidual()).isFinite().isPositive();
    }

    @Test
    void rejectsMismatchedDimensions() {
        assertThatThrownBy(() -> LyapunovResidual.of(CommonOps_DDRM.identity(2),
                CommonOps_DDRM.identity(2), CommonOps_DDRM.identity(3)))
                        .isInstanceOf(IllegalArgumentException.class);
    }
}
