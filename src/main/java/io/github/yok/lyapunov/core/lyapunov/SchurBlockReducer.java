package io.github.yok.lyapunov.core.lyapunov;

import com.google.common.base.Preconditions;
import io.github.yok.lyapunov.core.linearalgebra.RealSchurDecompositionBackend;
import io.github.yok.lyapunov.core.linearalgebra.RealSchurDecompositionBackend.RealSchurResult;
import io.github.yok.lyapunov.core.linearalgebra.SchurDecompositionException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * A を実 Schur 形 {@code T = U^T A U} に変換し、T の対角ブロック分割を決めるクラスです。
 *
 * <p>
 * 分解そのものは {@link RealSchurDecompositionBackend} に委ね、本クラスは副対角成分を走査して 各対角ブロックを 1×1 か 2×2（複素共役固有値対）に分類します。
 * 分類は QR 反復の収束判定と同じ尺度 {@code |t(i+1,i)| <= ε (|t(i,i)| + |t(i+1,i+1)|)} で行うため、 反復で分離されなかった 2×2
 * ブロックを 1×1 に分けてしまうことはありません。
 * </p>
 *
 * <p>
 * 相対許容誤差から決まる閾値 {@code relativeTolerance * ||A||_F} は、固有値和の特異判定と、 第一副対角より下の成分の検査に使います。
 * </p>
 */
@Slf4j
public final class SchurBlockReducer {

    /**
     * 倍精度の丸め単位です。
     */
    private static final double EPS = Math.ulp(1.0);

    /**
     * 実 Schur 分解のバックエンドです。
     */
    private final RealSchurDecompositionBackend schurBackend;

    /**
     * 相対許容誤差です。
     */
    @Getter
    private final double relativeTolerance;

    /**
     * Schur 分解器を生成します。
     *
     * @param schurBackend 実 Schur 分解のバックエンドです（null 不可）
     * @param relativeTolerance 相対許容誤差です（正の有限値）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public SchurBlockReducer(RealSchurDecompositionBackend schurBackend, double relativeTolerance) {
        Preconditions.checkArgument(schurBackend != null, "schurBackend は null 不可です");
        Preconditions.checkArgument(relativeTolerance > 0.0 && Double.isFinite(relativeTolerance),
                "relativeTolerance は正の有限値が必要です: %s", relativeTolerance);
        this.schurBackend = schurBackend;
        this.relativeTolerance = relativeTolerance;
    }

    /**
     * A を準上三角化し、ブロック分割と閾値を付けて返します。
     *
     * @param a 正方行列 A です（変更されません）
     * @return 準上三角化した問題です
     * @throws SchurDecompositionException 分解に失敗した場合、または結果が準上三角の構造を満たさない場合に発生します
     */
    public ReducedLyapunovProblem reduce(DMatrixRMaj a) {
        int n = a.numRows;
        double threshold = LyapunovKernels.threshold(relativeTolerance, a);

        RealSchurResult schur = schurBackend.decompose(a);
        if (schur == null || schur.getT() == null || schur.getU() == null) {
            throw new SchurDecompositionException("実 Schur 分解の結果が取得できません");
        }

        DMatrixRMaj t = schur.getT();
        DMatrixRMaj u = schur.getU();
        if (t.numRows != n || t.numCols != n || u.numRows != n || u.numCols != n) {
            throw new SchurDecompositionException("実 Schur 分解の結果の次元が不正です: T=" + t.numRows + "x"
                    + t.numCols + ", U=" + u.numRows + "x" + u.numCols + ", n=" + n);
        }

        BlockPartition partition = partition(t, threshold);

        log.debug("準上三角化が完了しました。次元={}、ブロック数={}、2×2 ブロック数={}、閾値={}", n,
                partition.blockCount(), partition.complexPairCount(), threshold);

        return new ReducedLyapunovProblem(t, u, partition, threshold);
    }

    /**
     * 準上三角行列の副対角成分を走査し、対角ブロック分割を求めます。
     *
     * @param t 準上三角行列です
     * @param threshold 第一副対角より下の成分を 0 とみなす閾値（絶対値）です
     * @return 対角ブロック分割です
     * @throws SchurDecompositionException 2×2 を超えるブロックや、第一副対角より下の非ゼロ成分がある場合に発生します
     */
    public static BlockPartition partition(DMatrixRMaj t, double threshold) {
        int n = t.numRows;

        for (int i = 2; i < n; i++) {
            for (int j = 0; j < i - 1; j++) {
                if (Math.abs(t.get(i, j)) > threshold) {
                    throw new SchurDecompositionException(
                            "準上三角行列の第一副対角より下に非ゼロ成分があります: (" + i + ", " + j + ")=" + t.get(i, j));
                }
            }
        }

        List<DiagonalBlock> blocks = new ArrayList<>();
        int i = 0;
        while (i < n) {
            boolean opensPair = (i + 1 < n) && !isNegligibleSubDiagonal(t, i);
            if (!opensPair) {
                DMatrixRMaj block = CommonOps_DDRM.extract(t, i, i + 1, i, i + 1);
                blocks.add(new DiagonalBlock(i, 1, LyapunovKernels.eigenvalues(block)));
                i++;
                continue;
            }

            // 連続する 2 つの副対角成分が非ゼロなら 3×3 以上のブロックになってしまいます。
            if (i + 2 < n && !isNegligibleSubDiagonal(t, i + 1)) {
                throw new SchurDecompositionException(
                        "準上三角行列に 2×2 を超える対角ブロックがあります: 先頭 index=" + i);
            }
            DMatrixRMaj block = CommonOps_DDRM.extract(t, i, i + 2, i, i + 2);
            blocks.add(new DiagonalBlock(i, 2, LyapunovKernels.eigenvalues(block)));
            i += 2;
        }

        return new BlockPartition(Collections.unmodifiableList(blocks), n);
    }

    /**
     * 副対角成分 {@code t(i+1, i)} が、隣接する対角成分に対して丸め誤差程度以下かを判定します。
     *
     * @param t 準上三角行列です
     * @param i 副対角成分の列 index です
     * @return 無視できる場合は true です
     */
    private static boolean isNegligibleSubDiagonal(DMatrixRMaj t, int i) {
        double scale = Math.abs(t.get(i, i)) + Math.abs(t.get(i + 1, i + 1));
        return Math.abs(t.get(i + 1, i)) <= EPS * scale;
    }
}
