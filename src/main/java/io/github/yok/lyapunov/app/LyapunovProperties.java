package io.github.yok.lyapunov.app;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Positive;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * lyapunov-solver の設定値（lyapunov.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "lyapunov")
public class LyapunovProperties {

    /**
     * 入力設定です。
     */
    @Valid
    private Input input = new Input();

    /**
     * ソルバ設定です。
     */
    @Valid
    private Solver solver = new Solver();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "lyapunov")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Input i = getInput();
        Solver s = getSolver();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "input",
                // coefficientMatrix: 係数行列 A の CSV
                "coefficientMatrix", i.getCoefficientMatrix(),
                // rightHandSideMatrix: 右辺行列 Q の CSV
                "rightHandSideMatrix", i.getRightHandSideMatrix());

        appendSection(sb, nl, "solver",
                // relativeTolerance: 特異判定の相対許容誤差
                "relativeTolerance", s.getRelativeTolerance(),
                // maxIterationsPerEigenvalue: QR 反復の上限係数
                "maxIterationsPerEigenvalue", s.getMaxIterationsPerEigenvalue(),
                // residualWarningThreshold: 相対残差の警告閾値
                "residualWarningThreshold", s.getResidualWarningThreshold());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * <pre>
     *   section:
     *     key: value
     * </pre>
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Input {

        /**
         * 係数行列 A の CSV ファイルです。
         */
        @NotBlank
        private String coefficientMatrix = "./data/A.csv";

        /**
         * 右辺行列 Q（対称）の CSV ファイルです。
         */
        @NotBlank
        private String rightHandSideMatrix = "./data/Q.csv";
    }

    @Data
    public static class Solver {

        /**
         * 特異判定に用いる相対許容誤差です。
         *
         * <p>
         * 閾値は {@code relativeTolerance * ||A||_F} です。
         * </p>
         */
        @Positive
        private double relativeTolerance = 1e-10;

        /**
         * 実 Schur 分解の QR 反復の上限係数です（反復総数の上限は {@code 係数 * max(10, n)}）。
         */
        @Min(1)
        private int maxIterationsPerEigenvalue = 30;

        /**
         * 相対残差 {@code ||A^T X + X A + Q|| / ||Q||} がこの値を超えたら警告を出します。
         */
        @Positive
        private double residualWarningThreshold = 1e-8;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        @NotBlank
        private String dir = "./out";
    }
}
