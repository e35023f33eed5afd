package io.github.yok.lyapunov.core.lyapunov;

import java.util.List;
import lombok.Value;

/**
 * 準上三角行列 T の対角ブロック分割を表すクラスです。
 *
 * <p>
 * ブロックは左上から右下の順に並び、{@code [0, n)} を隙間なく覆います。
 * </p>
 */
@Value
public class BlockPartition {

    /**
     * 対角ブロックの列です（左上から順）。
     */
    List<DiagonalBlock> blocks;

    /**
     * 分割対象の次元 n です。
     */
    int dimension;

    /**
     * ブロック数を返します。
     *
     * @return ブロック数です
     */
    public int blockCount() {
        return blocks.size();
    }

    /**
     * 2×2 ブロック（複素共役固有値対）の数を返します。
     *
     * @return 2×2 ブロックの数です
     */
    public int complexPairCount() {
        int count = 0;
        for (DiagonalBlock block : blocks) {
            if (block.getSize() == 2) {
                count++;
            }
        }
        return count;
    }
}
