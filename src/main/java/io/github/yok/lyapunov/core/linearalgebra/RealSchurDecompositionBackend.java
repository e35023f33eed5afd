package io.github.yok.lyapunov.core.linearalgebra;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 実 Schur 分解を提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * 使用するライブラリを差し替えやすくするため、また固定の (T, U) を返すスタブで 後段の処理を検証できるようにするためのインタフェースです。
 * </p>
 */
public interface RealSchurDecompositionBackend {

    /**
     * 実正方行列を実 Schur 分解し、{@code T = U^T A U} を満たす (T, U) を返します。
     *
     * @param matrix 実正方行列です（変更されません）
     * @return 実 Schur 分解の結果です
     * @throws SchurDecompositionException 分解に失敗した場合（反復が収束しない場合など）に発生します
     */
    RealSchurResult decompose(DMatrixRMaj matrix);

    /**
     * 実 Schur 分解の結果（準上三角行列と直交行列）を保持するクラスです。
     *
     * <p>
     * {@code t} の対角ブロックは 1×1（実固有値）または 2×2（複素共役固有値対）です。 第一副対角より下の成分は厳密に 0 です。
     * </p>
     */
    @Value
    class RealSchurResult {

        /**
         * 準上三角行列 T です。
         */
        DMatrixRMaj t;

        /**
         * 直交行列 U です（{@code A = U T U^T}）。
         */
        DMatrixRMaj u;
    }
}
