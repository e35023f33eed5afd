package io.github.yok.lyapunov.core.lyapunov;

import com.google.common.base.Preconditions;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 準上三角化した Lyapunov 方程式 {@code T^T X' + X' T = -Q'} をブロックごとに解くクラスです。
 *
 * <p>
 * T はブロック上三角なので、ブロック (i, j) の方程式は
 * </p>
 *
 * <pre>
 *   Tii^T X'ij + X'ij Tjj = -( Q'ij + Σ_{k&lt;i} Tki^T X'kj + Σ_{k&lt;j} X'ik Tkj )
 * </pre>
 *
 * <p>
 * となり、右辺の補正項は添字の小さいブロックだけに依存します。 そこでブロック列 j を左から、各列の中でブロック行 i = 0..j を上から順に解きます。 対角ブロックは 1×1 / 2×2
 * の閉形式カーネルで、非対角ブロックは小さな Sylvester 方程式として解き、 その転置を (j, i) にも書き込むことで X' の対称性を構成的に保証します。
 * </p>
 */
@Slf4j
public final class QuasiTriangularLyapunovSolver {

    /**
     * 準上三角化した Lyapunov 方程式を解きます。
     *
     * @param problem 準上三角化した問題（T, ブロック分割, 閾値）です
     * @param transformedQ 変換後の右辺 {@code Q' = U^T Q U} です（上三角のみ参照します）
     * @return 解 X'（対称）です
     * @throws IllegalArgumentException 次元が不整合の場合に発生します
     * @throws SingularLyapunovEquationException 固有値の和が閾値未満の組を検出した場合に発生します
     */
    public DMatrixRMaj solve(ReducedLyapunovProblem problem, DMatrixRMaj transformedQ) {
        Preconditions.checkArgument(problem != null, "problem は null 不可です");
        Preconditions.checkArgument(transformedQ != null, "transformedQ は null 不可です");

        DMatrixRMaj t = problem.getT();
        int n = t.numRows;
        Preconditions.checkArgument(transformedQ.numRows == n && transformedQ.numCols == n,
                "transformedQ の次元が T と一致しません: %sx%s（期待値 %sx%s）", transformedQ.numRows,
                transformedQ.numCols, n, n);
        Preconditions.checkArgument(problem.getPartition().getDimension() == n,
                "ブロック分割の次元が T と一致しません: %s vs %s", problem.getPartition().getDimension(), n);

        List<DiagonalBlock> blocks = problem.getPartition().getBlocks();
        double threshold = problem.getThreshold();

        DMatrixRMaj x = new DMatrixRMaj(n, n);

        for (int j = 0; j < blocks.size(); j++) {
            DiagonalBlock colBlock = blocks.get(j);
            DMatrixRMaj tjj = diagonalBlockOf(t, colBlock);

            for (int i = 0; i <= j; i++) {
                DiagonalBlock rowBlock = blocks.get(i);
                DMatrixRMaj r = effectiveRightHandSide(t, transformedQ, x, rowBlock, colBlock);

                if (i == j) {
                    DMatrixRMaj xjj = (colBlock.getSize() == 1)
                            ? LyapunovKernels.solve1By1(tjj, r, threshold)
                            : LyapunovKernels.solve2By2(tjj, r, threshold);
                    CommonOps_DDRM.insert(xjj, x, colBlock.getStart(), colBlock.getStart());
                } else {
                    DMatrixRMaj tii = diagonalBlockOf(t, rowBlock);
                    DMatrixRMaj xij = LyapunovKernels.solveCoupledBlock(tii, tjj, r, threshold);
                    CommonOps_DDRM.insert(xij, x, rowBlock.getStart(), colBlock.getStart());
                    CommonOps_DDRM.insert(CommonOps_DDRM.transpose(xij, null), x,
                            colBlock.getStart(), rowBlock.getStart());
                }
            }
        }

        log.debug("ブロック後退代入が完了しました。次元={}、ブロック数={}", n, blocks.size());
        return x;
    }

    /**
     * ブロック (i, j) の実効右辺 {@code Q'ij + Σ_{k<i} Tki^T X'kj + Σ_{k<j} X'ik Tkj} を計算します。
     *
     * <p>
     * x は解き終えたブロックだけが埋まった途中の解です。ここで参照する成分は全て解き終えたブロックに属します。
     * </p>
     *
     * @param t 準上三角行列です
     * @param q 変換後の右辺です
     * @param x 途中の解です
     * @param rowBlock 行側ブロック i です
     * @param colBlock 列側ブロック j です
     * @return 実効右辺（行ブロックサイズ × 列ブロックサイズ）です
     */
    private static DMatrixRMaj effectiveRightHandSide(DMatrixRMaj t, DMatrixRMaj q, DMatrixRMaj x,
            DiagonalBlock rowBlock, DiagonalBlock colBlock) {
        int rowStart = rowBlock.getStart();
        int colStart = colBlock.getStart();
        DMatrixRMaj r = new DMatrixRMaj(rowBlock.getSize(), colBlock.getSize());

        for (int row = rowStart; row < rowBlock.getEnd(); row++) {
            for (int col = colStart; col < colBlock.getEnd(); col++) {
                // 対角ブロックでは上三角だけを使うため、下三角側も上三角の値で埋めます。
                double sum = (row <= col) ? q.get(row, col) : q.get(col, row);
                for (int k = 0; k < rowStart; k++) {
                    sum += t.get(k, row) * x.get(k, col);
                }
                for (int k = 0; k < colStart; k++) {
                    sum += x.get(row, k) * t.get(k, col);
                }
                r.set(row - rowStart, col - colStart, sum);
            }
        }
        return r;
    }

    /**
     * T からブロックに対応する対角部分行列を取り出します。
     *
     * @param t 準上三角行列です
     * @param block 対角ブロックです
     * @return 対角部分行列です
     */
    private static DMatrixRMaj diagonalBlockOf(DMatrixRMaj t, DiagonalBlock block) {
        return CommonOps_DDRM.extract(t, block.getStart(), block.getEnd(), block.getStart(),
                block.getEnd());
    }
}
