package io.github.yok.lyapunov.core.lyapunov;

import lombok.Getter;
import org.ejml.data.Complex_F64;

/**
 * Lyapunov 方程式の解の一意性条件（任意の固有値 λi, λj について λi + λj ≠ 0）が 閾値の範囲で破れていることを表す例外です。
 *
 * <p>
 * ブロックごとに解く過程で最初に検出した固有値の組を保持します。
 * </p>
 */
@Getter
public class SingularLyapunovEquationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 和が 0 に近い固有値の組のうち 1 つ目です。
     */
    private final transient Complex_F64 firstEigenvalue;

    /**
     * 和が 0 に近い固有値の組のうち 2 つ目です。
     */
    private final transient Complex_F64 secondEigenvalue;

    /**
     * 判定に用いた閾値（絶対値）です。
     */
    private final double threshold;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     * @param firstEigenvalue 1 つ目の固有値です
     * @param secondEigenvalue 2 つ目の固有値です
     * @param threshold 判定に用いた閾値です
     */
    public SingularLyapunovEquationException(String message, Complex_F64 firstEigenvalue,
            Complex_F64 secondEigenvalue, double threshold) {
        super(message);
        this.firstEigenvalue = firstEigenvalue;
        this.secondEigenvalue = secondEigenvalue;
        this.threshold = threshold;
    }
}
