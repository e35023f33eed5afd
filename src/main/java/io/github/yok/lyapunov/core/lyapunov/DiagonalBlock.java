package io.github.yok.lyapunov.core.lyapunov;

import lombok.Value;
import org.ejml.data.Complex_F64;

/**
 * 準上三角行列 T の対角ブロック 1 つを表すクラスです。
 *
 * <p>
 * 添字範囲 {@code [start, start + size)} を占め、size は 1（実固有値）または 2（複素共役固有値対）です。
 * </p>
 */
@Value
public class DiagonalBlock {

    /**
     * ブロックの先頭添字です。
     */
    int start;

    /**
     * ブロックサイズ（1 または 2）です。
     */
    int size;

    /**
     * ブロックの固有値です（長さは size）。
     */
    Complex_F64[] eigenvalues;

    /**
     * ブロックの末尾添字（排他的）を返します。
     *
     * @return {@code start + size} です
     */
    public int getEnd() {
        return start + size;
    }
}
