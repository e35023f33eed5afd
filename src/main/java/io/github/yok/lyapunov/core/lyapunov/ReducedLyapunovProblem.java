package io.github.yok.lyapunov.core.lyapunov;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 実 Schur 分解で準上三角化した Lyapunov 方程式 {@code T^T X' + X' T = -Q'} の係数側を保持するクラスです。
 *
 * <p>
 * 1 回の求解ごとに生成し、呼び出しをまたいで再利用しません。
 * </p>
 */
@Value
public class ReducedLyapunovProblem {

    /**
     * 準上三角行列 T（{@code T = U^T A U}）です。
     */
    DMatrixRMaj t;

    /**
     * 直交行列 U です。
     */
    DMatrixRMaj u;

    /**
     * T の対角ブロック分割です。
     */
    BlockPartition partition;

    /**
     * ブロック分類と特異判定に共通で用いる閾値（絶対値）です。
     */
    double threshold;
}
