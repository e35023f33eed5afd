package io.github.yok.lyapunov.core.lyapunov;

import io.github.yok.lyapunov.core.linearalgebra.EjmlRealSchurDecompositionBackend;
import io.github.yok.lyapunov.core.linearalgebra.RealSchurDecompositionBackend;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * Bartels–Stewart 法で実連続時間 Lyapunov 方程式を解くクラスです。
 *
 * <p>
 * 入力検証 → A の実 Schur 分解（{@code T = U^T A U}）→ {@code Q' = U^T Q U} → ブロック後退代入で
 * {@code T^T X' + X' T = -Q'} を解く → {@code X = U X' U^T}、の順に処理します。 インスタンスは不変で、呼び出しごとに作業行列を確保するため、
 * 複数スレッドから同時に呼び出せます。
 * </p>
 */
@Slf4j
public final class BartelsStewartLyapunovSolver implements ContinuousLyapunovSolver {

    /**
     * 入力検証です。
     */
    private final LyapunovInputValidator validator;

    /**
     * 準上三角化とブロック分割です。
     */
    private final SchurBlockReducer reducer;

    /**
     * ブロック後退代入です。
     */
    private final QuasiTriangularLyapunovSolver blockSolver;

    /**
     * EJML バックエンドと既定の相対許容誤差で生成します。
     */
    public BartelsStewartLyapunovSolver() {
        this(new EjmlRealSchurDecompositionBackend(), LyapunovKernels.DEFAULT_RELATIVE_TOLERANCE);
    }

    /**
     * バックエンドと相対許容誤差を指定して生成します。
     *
     * @param schurBackend 実 Schur 分解のバックエンドです（null 不可）
     * @param relativeTolerance 特異判定と準上三角構造の検査に用いる相対許容誤差です（正の有限値）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public BartelsStewartLyapunovSolver(RealSchurDecompositionBackend schurBackend,
            double relativeTolerance) {
        this.validator = new LyapunovInputValidator();
        this.reducer = new SchurBlockReducer(schurBackend, relativeTolerance);
        this.blockSolver = new QuasiTriangularLyapunovSolver();
    }

    /**
     * 一意な対称解 X を求めます。
     *
     * @param a 実正方行列 A です（変更されません）
     * @param q 実対称行列 Q です（変更されません）
     * @return 対称解 X です
     */
    @Override
    public DMatrixRMaj solve(DMatrixRMaj a, DMatrixRMaj q) {
        validator.validate(a, q);

        int n = a.numRows;

        // 1) A = U T U^T
        ReducedLyapunovProblem problem = reducer.reduce(a);
        DMatrixRMaj u = problem.getU();

        // 2) Q' = U^T Q U
        DMatrixRMaj work = new DMatrixRMaj(n, n);
        DMatrixRMaj transformedQ = new DMatrixRMaj(n, n);
        CommonOps_DDRM.multTransA(u, q, work);
        CommonOps_DDRM.mult(work, u, transformedQ);

        // 3) T^T X' + X' T = -Q'
        DMatrixRMaj reducedX = blockSolver.solve(problem, transformedQ);

        // 4) X = U X' U^T
        DMatrixRMaj x = new DMatrixRMaj(n, n);
        CommonOps_DDRM.mult(u, reducedX, work);
        CommonOps_DDRM.multTransB(work, u, x);

        // 逆変換の丸め誤差で崩れた対称性を揃えます。
        symmetrize(x);

        log.debug("Lyapunov 方程式を解きました。次元={}、ブロック数={}、2×2 ブロック数={}", n,
                problem.getPartition().blockCount(), problem.getPartition().complexPairCount());
        return x;
    }

    /**
     * 相対許容誤差を返します。
     *
     * @return 相対許容誤差です
     */
    public double getRelativeTolerance() {
        return reducer.getRelativeTolerance();
    }

    /**
     * 行列を {@code (X + X^T) / 2} で置き換えます。
     *
     * @param x 正方行列です（上書きされます）
     */
    private static void symmetrize(DMatrixRMaj x) {
        for (int i = 0; i < x.numRows; i++) {
            for (int j = i + 1; j < x.numCols; j++) {
                double mean = 0.5 * (x.get(i, j) + x.get(j, i));
                x.set(i, j, mean);
                x.set(j, i, mean);
            }
        }
    }
}
