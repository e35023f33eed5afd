package io.github.yok.lyapunov.app;

import io.github.yok.lyapunov.core.lyapunov.ContinuousLyapunovSolver;
import io.github.yok.lyapunov.core.lyapunov.LyapunovKernels;
import io.github.yok.lyapunov.core.lyapunov.LyapunovResidual;
import io.github.yok.lyapunov.in.MatrixReader;
import io.github.yok.lyapunov.out.ResultWriter;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で lyapunov-solver を実行するクラスです。
 *
 * <p>
 * CSV から A と Q を読み込み、{@code A^T X + X A = -Q} を解いて、残差を確認したうえで X を CSV に出力します。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LyapunovCliRunner implements CommandLineRunner {

    /**
     * lyapunov-solver の設定値（lyapunov.*）です。
     */
    private final LyapunovProperties properties;

    /**
     * 行列の入力ロジックです。
     */
    private final MatrixReader matrixReader;

    /**
     * Lyapunov ソルバです。
     */
    private final ContinuousLyapunovSolver solver;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== lyapunov-solver start: solve A^T X + X A = -Q ===");
        System.out.print(properties.toMultilineString());

        LyapunovProperties.Input input = properties.getInput();
        LyapunovProperties.Solver solverProperties = properties.getSolver();

        DMatrixRMaj a = matrixReader.read(input.getCoefficientMatrix());
        DMatrixRMaj q = matrixReader.read(input.getRightHandSideMatrix());

        System.out.println("入力: A=" + a.numRows + "x" + a.numCols + ", Q=" + q.numRows + "x"
                + q.numCols);

        long t0 = System.nanoTime();
        DMatrixRMaj x = solver.solve(a, q);
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;

        LyapunovResidual residual = LyapunovResidual.of(a, q, x);
        double relativeTolerance = solverProperties.getRelativeTolerance();
        double threshold = LyapunovKernels.threshold(relativeTolerance, a);

        if (residual.getRelativeResidual() > solverProperties.getResidualWarningThreshold()) {
            log.warn("相対残差が警告閾値を超えました。相対残差={}、警告閾値={}（A の条件が悪い可能性があります）",
                    fmtE(residual.getRelativeResidual()),
                    fmtE(solverProperties.getResidualWarningThreshold()));
        } else {
            log.info("Lyapunov 方程式を解きました。次元={}、所要時間={}ms、相対残差={}", x.numRows, elapsedMs,
                    fmtE(residual.getRelativeResidual()));
        }

        resultWriter.write(x, residual, relativeTolerance, threshold, elapsedMs);

        System.out.println("結果: n=" + x.numRows + ", 残差=" + fmtE(residual.getResidualNorm())
                + ", 相対残差=" + fmtE(residual.getRelativeResidual()) + ", 対称性の崩れ="
                + fmtE(residual.getSymmetryDefect()));
    }

    /**
     * 数値を有効数字5桁の指数表記に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmtE(double v) {
        return String.format(Locale.ROOT, "%.5e", v);
    }
}
