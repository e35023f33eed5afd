package io.github.yok.lyapunov.out;

import io.github.yok.lyapunov.core.lyapunov.LyapunovResidual;
import org.ejml.data.DMatrixRMaj;

/**
 * 計算結果を出力する処理のインタフェースです。
 *
 * <p>
 * 解 X と、その品質を示す残差・判定に用いた閾値を受け取ります。
 * </p>
 */
public interface ResultWriter {

    /**
     * 解と補助情報を出力します。
     *
     * @param x 解 X です
     * @param residual 解の残差です
     * @param relativeTolerance 求解に用いた相対許容誤差です
     * @param threshold 求解に用いた閾値（絶対値）です
     * @param elapsedMillis 求解の所要時間（ミリ秒）です
     */
    void write(DMatrixRMaj x, LyapunovResidual residual, double relativeTolerance,
            double threshold, long elapsedMillis);
}
