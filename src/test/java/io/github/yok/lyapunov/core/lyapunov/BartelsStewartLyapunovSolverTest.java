package io.github.yok.lyapunov.core.lyapunov;

import static io.github.yok.lyapunov.core.lyapunov.LyapunovTestSupport.assertMatrixClose;
import static io.github.yok.lyapunov.core.lyapunov.LyapunovTestSupport.assertSolvesLyapunov;
import static io.github.yok.lyapunov.core.lyapunov.LyapunovTestSupport.matrix;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import io.github.yok.lyapunov.core.linearalgebra.EjmlRealSchurDecompositionBackend;
import java.util.Random;
import java.util.stream.Stream;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.NormOps_DDRM;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class BartelsStewartLyapunovSolverTest {

    private final ContinuousLyapunovSolver solver = new BartelsStewartLyapunovSolver();

    static Stream<Arguments> invalidShapes() {
        return Stream.of(
                // A が正方でない
                Arguments.of(new DMatrixRMaj(1, 2), new DMatrixRMaj(2, 2)),
                // Q が正方でない
                Arguments.of(new DMatrixRMaj(2, 2), new DMatrixRMaj(1, 2)),
                // 次元が一致しない
                Arguments.of(new DMatrixRMaj(2, 2), new DMatrixRMaj(1, 1)));
    }

    @ParameterizedTest
    @MethodSource("invalidShapes")
    void rejectsInvalidShapes(DMatrixRMaj a, DMatrixRMaj q) {
        assertThatThrownBy(() -> solver.solve(a, q)).isInstanceOf(IllegalArgumentException.class);
    }

    static Stream<DMatrixRMaj> singularCoefficients() {
        return Stream.of(
                // 和が 0 になる複素共役対 ±i
                matrix(new double[][] {{0, 1}, {-1, 0}}),
                // 固有値 0
                matrix(new double[][] {{0, 0}, {0, -1}}),
                // 閾値以内で 0 に近い固有値
                matrix(new double[][] {{1, 0}, {0, -1e-11}}),
                // 和が閾値以内で 0 に近い実固有値の対
                matrix(new double[][] {{-1 + 1e-10, 0}, {0, 1 - 5e-11}}),
                // 異なる 2×2 ブロック間で和が 0 になる対（-1±i と 1±i）
                matrix(new double[][] {
                        {-1, 1, 0, 0},
                        {-1, -1, 0, 0},
                        {0, 0, 1, 1},
                        {0, 0, -1, 1}}));
    }

    @ParameterizedTest
    @MethodSource("singularCoefficients")
    void rejectsEigenvaluePairsSummingToZero(DMatrixRMaj a) {
        DMatrixRMaj q = CommonOps_DDRM.identity(a.numRows);

        assertThatThrownBy(() -> solver.solve(a, q))
                .isInstanceOf(SingularLyapunovEquationException.class);
    }

    @Test
    void solves1By1() {
        DMatrixRMaj a = matrix(new double[][] {{-1}});
        DMatrixRMaj q = matrix(new double[][] {{1}});

        DMatrixRMaj x = solver.solve(a, q);

        assertMatrixClose(x, matrix(new double[][] {{0.5}}), 1e-15);
        assertSolvesLyapunov(a, q, x, 1e-14);
    }

    @Test
    void solves2By2() {
        DMatrixRMaj a = matrix(new double[][] {{1, 2}, {-3, -4}});
        DMatrixRMaj at = CommonOps_DDRM.transpose(a, null);
        DMatrixRMaj q = matrix(new double[][] {{3, 1}, {1, 1}});
        DMatrixRMaj expected = matrix(new double[][] {
                {6.0 + 1.0 / 6.0, -(3.0 + 5.0 / 6.0)},
                {-(3.0 + 5.0 / 6.0), 3.0}});

        DMatrixRMaj x = solver.solve(at, q);

        assertMatrixClose(x, expected, 1e-10);
        assertSolvesLyapunov(at, q, x, 1e-12);
    }

    @Test
    void solves3By3NegativeIdentity() {
        DMatrixRMaj a = CommonOps_DDRM.identity(3);
        CommonOps_DDRM.changeSign(a);
        DMatrixRMaj q = CommonOps_DDRM.identity(3);

        DMatrixRMaj x = solver.solve(a, q);

        DMatrixRMaj expected = CommonOps_DDRM.identity(3);
        CommonOps_DDRM.scale(0.5, expected);
        assertMatrixClose(x, expected, 1e-14);
    }

    @Test
    void solves3By3WithComplexPairBlock() {
        // 固有値 -0.5±0.866i と -1 を持つため、2×2 ブロックと 1×1 ブロックに分かれる
        DMatrixRMaj a = matrix(new double[][] {{0, 1, 0}, {-1, -1, 0}, {0, 0, -1}});
        DMatrixRMaj q = CommonOps_DDRM.identity(3);
        DMatrixRMaj expected = matrix(new double[][] {{1.5, 0.5, 0}, {0.5, 1, 0}, {0, 0, 0.5}});

        DMatrixRMaj x = solver.solve(a, q);

        assertMatrixClose(x, expected, 1e-12);
        assertSolvesLyapunov(a, q, x, 1e-12);
    }

    @Test
    void solves4By4WithComplexPairBlock() {
        DMatrixRMaj q = CommonOps_DDRM.identity(4);

        DMatrixRMaj a1 = matrix(new double[][] {
                {-1, 0, 0, 0},
                {0, 0, 1, 0},
                {0, -1, -1, 0},
                {0, 0, 0, -1}});
        assertSolvesLyapunov(a1, q, solver.solve(a1, q), 1e-12);

        DMatrixRMaj a2 = matrix(new double[][] {
                {-1, 0.43, -1.5, 0.2},
                {0, 0, 1, 0},
                {0, -1, -1, 0},
                {0, 0, 0, -1}});
        assertSolvesLyapunov(a2, q, solver.solve(a2, q), 1e-12);
    }

    @Test
    void solves10By10AgainstReferenceSolution() {
        DMatrixRMaj aHalf = matrix(new double[][] {
                {0.1622, 0.4505, 0.1067, 0.4314, 0.8530, 0.4173, 0.7803, 0.2348, 0.5470, 0.9294},
                {0.7943, 0.0838, 0.9619, 0.9106, 0.6221, 0.0497, 0.3897, 0.3532, 0.2963, 0.7757},
                {0.3112, 0.2290, 0.0046, 0.1818, 0.3510, 0.9027, 0.2417, 0.8212, 0.7447, 0.4868},
                {0.5285, 0.9133, 0.7749, 0.2638, 0.5132, 0.9448, 0.4039, 0.0154, 0.1890, 0.4359},
                {0.1656, 0.1524, 0.8173, 0.1455, 0.4018, 0.4909, 0.0965, 0.0430, 0.6868, 0.4468},
                {0.6020, 0.8258, 0.8687, 0.1361, 0.0760, 0.4893, 0.1320, 0.1690, 0.1835, 0.3063},
                {0.2630, 0.5383, 0.0844, 0.8693, 0.2399, 0.3377, 0.9421, 0.6491, 0.3685, 0.5085},
                {0.6541, 0.9961, 0.3998, 0.5797, 0.1233, 0.9001, 0.9561, 0.7317, 0.6256, 0.5108},
                {0.6892, 0.0782, 0.2599, 0.5499, 0.1839, 0.3692, 0.5752, 0.6477, 0.7802, 0.8176},
                {0.7482, 0.4427, 0.8001, 0.1450, 0.2400, 0.1112, 0.0598, 0.4509, 0.0811, 0.7948}});

        // A = -A_half A_half^T は構成上、固有値が 0 以下
        DMatrixRMaj a = new DMatrixRMaj(10, 10);
        CommonOps_DDRM.multTransB(-1.0, aHalf, aHalf, a);
        DMatrixRMaj q = CommonOps_DDRM.identity(10);

        DMatrixRMaj expected = matrix(new double[][] {
                {5.174254345982084, 3.785962224550206, 1.716851637434820, -6.423467487688685,
                        -3.303527757978912, 7.751563477958063, -5.453159309169113,
                        2.756394136066010, -2.383245959863380, -4.646704649671120},
                {3.785962224550206, 7.733223722073816, 0.984667079496413, -6.985751984700270,
                        -1.468117803443308, -2.381962895250860, -11.406359384231266,
                        13.403654956780908, -7.905663634873605, -1.707241841788795},
                {1.716851637434820, 0.984667079496413, 2.810911691014975, -2.143076146699036,
                        -2.568865412823195, 7.579636343964955, 0.989231265555543,
                        -4.122828484247153, 0.221166408736615, -3.501510532379084},
                {-6.423467487688685, -6.985751984700270, -2.143076146699036, 11.153852606907163,
                        2.424134196572830, -6.287532769413548, 9.904445394226688,
                        -9.890648864864904, 7.335273514428504, 4.356558308557354},
                {-3.303527757978912, -1.468117803443308, -2.568865412823195, 2.424134196572830,
                        5.366429856975694, -11.563947250836353, 0.393445687076630,
                        5.444872146647519, -2.596780779003215, 6.133050237127323},
                {7.751563477958063, -2.381962895250860, 7.579636343964955, -6.287532769413548,
                        -11.563947250836353, 42.514033344951628, 11.168249111715349,
                        -29.261574349736009, 12.223632134534295, -18.633242175973727},
                {-5.453159309169113, -11.406359384231266, 0.989231265555543, 9.904445394226688,
                        0.393445687076630, 11.168249111715349, 21.520015757259888,
                        -27.074863900080999, 12.930264173939383, -0.821271729309166},
                {2.756394136066010, 13.403654956780908, -4.122828484247153, -9.890648864864904,
                        5.444872146647519, -29.261574349736009, -27.074863900080999,
                        42.402987995831381, -20.932210488385589, 9.041568418134542},
                {-2.383245959863380, -7.905663634873605, 0.221166408736615, 7.335273514428504,
                        -2.596780779003215, 12.223632134534295, 12.930264173939383,
                        -20.932210488385589, 13.535693361419060, -4.079542688309729},
                {-4.646704649671120, -1.707241841788795, -3.501510532379084, 4.356558308557354,
                        6.133050237127323, -18.633242175973727, -0.821271729309166,
                        9.041568418134542, -4.079542688309729, 10.282049375996213}});

        DMatrixRMaj x = solver.solve(a, q);

        assertMatrixClose(x, expected, 1e-10);
        assertSolvesLyapunov(a, q, x, 1e-9);
    }

    @Test
    void solvesRandomStableSystemWithComplexSpectrum() {
        // 非対称で複素固有値を含む安定行列 A = M - (||M||_F + 1) I
        Random random = new Random(0x1a9c0d5eL);
        int n = 12;
        DMatrixRMaj m = new DMatrixRMaj(n, n);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                m.set(i, j, random.nextGaussian());
            }
        }
        double shift = NormOps_DDRM.normF(m) + 1.0;
        DMatrixRMaj a = m.copy();
        for (int i = 0; i < n; i++) {
            a.add(i, i, -shift);
        }
        DMatrixRMaj q = new DMatrixRMaj(n, n);
        CommonOps_DDRM.multTransA(m, m, q);

        DMatrixRMaj x = solver.solve(a, q);

        assertSolvesLyapunov(a, q, x, 1e-11);
    }

    @Test
    void keepsWeaklyCoupledComplexPairTogether() {
        // 固有値 -1 ± 3.16e-4 i。副対角 -1e-9 を落とすと解が大きくずれる
        DMatrixRMaj a = matrix(new double[][] {{-1, 100}, {-1e-9, -1}});
        DMatrixRMaj q = CommonOps_DDRM.identity(2);

        DMatrixRMaj x = solver.solve(a, q);

        assertSolvesLyapunov(a, q, x, 1e-9);
    }

    @ParameterizedTest
    @ValueSource(doubles = {1e-12, 1e-3, 1e3, 1e12})
    void solutionScalesInverselyWithA(double c) {
        DMatrixRMaj a = matrix(new double[][] {{0, 1, 0}, {-1, -1, 0}, {0, 0, -1}});
        DMatrixRMaj q = CommonOps_DDRM.identity(3);
        DMatrixRMaj scaledA = a.copy();
        CommonOps_DDRM.scale(c, scaledA);

        DMatrixRMaj scaledX = solver.solve(scaledA, q);

        // X(cA) = X(A) / c
        CommonOps_DDRM.scale(c, scaledX);
        assertMatrixClose(scaledX, solver.solve(a, q), 1e-11);
    }

    @Test
    void solvesTinyButRegularSpectrum() {
        DMatrixRMaj a = matrix(new double[][] {{-1e-11, 0}, {0, -1e-11}});
        DMatrixRMaj q = CommonOps_DDRM.identity(2);

        DMatrixRMaj x = solver.solve(a, q);

        assertThat(x.get(0, 0)).isCloseTo(5e10, within(1.0));
        assertThat(x.get(1, 1)).isCloseTo(5e10, within(1.0));
        assertThat(x.get(0, 1)).isZero();
    }

    @Test
    void doesNotModifyInputs() {
        DMatrixRMaj a = matrix(new double[][] {{0, 1, 0}, {-1, -1, 0}, {0, 0, -1}});
        DMatrixRMaj q = matrix(new double[][] {{2, 1, 0}, {1, 3, 0}, {0, 0, 1}});
        DMatrixRMaj aCopy = a.copy();
        DMatrixRMaj qCopy = q.copy();

        solver.solve(a, q);

        assertThat(MatrixFeatures_DDRM.isIdentical(a, aCopy, 0.0)).isTrue();
        assertThat(MatrixFeatures_DDRM.isIdentical(q, qCopy, 0.0)).isTrue();
    }

    @Test
    void returnsExactlySymmetricSolution() {
        DMatrixRMaj a = matrix(new double[][] {
                {-1, 0.43, -1.5, 0.2},
                {0, 0, 1, 0},
                {0, -1, -1, 0},
                {0, 0, 0, -1}});
        DMatrixRMaj q = matrix(new double[][] {
                {2, 0.5, 0, 0},
                {0.5, 1, 0.25, 0},
                {0, 0.25, 3, 1},
                {0, 0, 1, 4}});

        DMatrixRMaj x = solver.solve(a, q);

        assertThat(MatrixFeatures_DDRM.isSymmetric(x, 0.0)).isTrue();
    }

    @Test
    void looserToleranceFlagsNearlySingularSpectrum() {
        DMatrixRMaj a = matrix(new double[][] {{-1e-6, 0}, {0, -1}});
        DMatrixRMaj q = CommonOps_DDRM.identity(2);

        // 既定の閾値では解ける
        assertSolvesLyapunov(a, q, solver.solve(a, q), 1e-10);

        BartelsStewartLyapunovSolver loose =
                new BartelsStewartLyapunovSolver(new EjmlRealSchurDecompositionBackend(), 1e-5);
        assertThat(loose.getRelativeTolerance()).isEqualTo(1e-5);
        assertThatThrownBy(() -> loose.solve(a, q))
                .isInstanceOf(SingularLyapunovEquationException.class);
    }

    @Test
    void rejectsNonPositiveTolerance() {
        assertThatThrownBy(
                () -> new BartelsStewartLyapunovSolver(new EjmlRealSchurDecompositionBackend(), 0.0))
                        .isInstanceOf(IllegalArgumentException.class);
    }
}
