package io.github.yok.lyapunov.app;

import io.github.yok.lyapunov.core.linearalgebra.EjmlRealSchurDecompositionBackend;
import io.github.yok.lyapunov.core.linearalgebra.RealSchurDecompositionBackend;
import io.github.yok.lyapunov.core.lyapunov.BartelsStewartLyapunovSolver;
import io.github.yok.lyapunov.core.lyapunov.ContinuousLyapunovSolver;
import io.github.yok.lyapunov.in.CsvMatrixReader;
import io.github.yok.lyapunov.in.MatrixReader;
import io.github.yok.lyapunov.out.CsvResultWriter;
import io.github.yok.lyapunov.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * EJML 実 Schur 分解 + Bartels–Stewart 法による Lyapunov ソルバの Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class LyapunovSolverConfiguration {

    /**
     * lyapunov-solver の設定値（lyapunov.*）です。
     */
    private final LyapunovProperties p;

    /**
     * 実 Schur 分解バックエンドを生成します。
     *
     * @return 実 Schur 分解バックエンドです
     */
    @Bean
    public RealSchurDecompositionBackend realSchurDecompositionBackend() {
        return new EjmlRealSchurDecompositionBackend(
                p.getSolver().getMaxIterationsPerEigenvalue());
    }

    /**
     * Lyapunov ソルバを生成します。
     *
     * @param schurBackend 実 Schur 分解バックエンドです
     * @return Lyapunov ソルバです
     */
    @Bean
    public ContinuousLyapunovSolver continuousLyapunovSolver(
            RealSchurDecompositionBackend schurBackend) {
        return new BartelsStewartLyapunovSolver(schurBackend,
                p.getSolver().getRelativeTolerance());
    }

    /**
     * 行列の入力ロジックを生成します。
     *
     * @return 行列の入力ロジックです
     */
    @Bean
    public MatrixReader matrixReader() {
        return new CsvMatrixReader();
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
