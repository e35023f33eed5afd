package io.github.yok.lyapunov.core.lyapunov;

import io.github.yok.lyapunov.core.linearalgebra.SchurDecompositionException;
import org.ejml.data.DMatrixRMaj;

/**
 * 実連続時間 Lyapunov 方程式 {@code A^T X + X A = -Q} を解くインタフェースです。
 */
public interface ContinuousLyapunovSolver {

    /**
     * 一意な対称解 X を求めます。
     *
     * <p>
     * 失敗した場合に途中結果は返しません。
     * </p>
     *
     * @param a 実正方行列 A です（変更されません）
     * @param q 実対称行列 Q です（変更されません）
     * @return 対称解 X です
     * @throws IllegalArgumentException A, Q が正方でない、または次元が一致しない場合に発生します
     * @throws SchurDecompositionException A の実 Schur 分解に失敗した場合に発生します
     * @throws SingularLyapunovEquationException A の固有値の和が 0 に近い組があり、解が一意でない場合に発生します
     */
    DMatrixRMaj solve(DMatrixRMaj a, DMatrixRMaj q);
}
