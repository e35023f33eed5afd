package io.github.yok.lyapunov.out;

import io.github.yok.lyapunov.core.lyapunov.LyapunovResidual;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.ejml.data.DMatrixRMaj;

/**
 * 計算結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（n は行列の次元）。
 * </p>
 *
 * <ul>
 * <li>{@code lyapunov_X_n=10.csv}（解 X。1 レコードが 1 行、ヘッダなし）</li>
 * <li>{@code lyapunov_meta_n=10.csv}（閾値・残差などの補助情報）</li>
 * </ul>
 *
 * <p>
 * 解のファイルは {@code CsvMatrixReader} でそのまま読み戻せる形式です。
 * </p>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "lyapunov";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 解と補助情報を出力します。
     *
     * @param x 解 X です
     * @param residual 解の残差です
     * @param relativeTolerance 求解に用いた相対許容誤差です
     * @param threshold 求解に用いた閾値（絶対値）です
     * @param elapsedMillis 求解の所要時間（ミリ秒）です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(DMatrixRMaj x, LyapunovResidual residual, double relativeTolerance,
            double threshold, long elapsedMillis) {

        if (x == null) {
            throw new IllegalArgumentException("x は null 不可です");
        }
        if (residual == null) {
            throw new IllegalArgumentException("residual は null 不可です");
        }

        try {
            Files.createDirectories(outputDir);

            // 1) 解 X
            writeSolutionCsv(x);

            // 2) メタ（閾値、残差、所要時間）
            writeMetaCsv(x, residual, relativeTolerance, threshold, elapsedMillis);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 解 X を出力します。
     *
     * @param x 解 X です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeSolutionCsv(DMatrixRMaj x) throws IOException {
        Path file = outputDir.resolve(buildFileName("X", x.numRows));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.DEFAULT.print(w)) {

            for (int i = 0; i < x.numRows; i++) {
                Object[] row = new Object[x.numCols];
                for (int j = 0; j < x.numCols; j++) {
                    // 読み戻しで値が変わらないよう、Double.toString の最短表現で出力します。
                    row[j] = Double.toString(x.get(i, j));
                }
                pr.printRecord(row);
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param x 解 X です
     * @param residual 解の残差です
     * @param relativeTolerance 相対許容誤差です
     * @param threshold 閾値です
     * @param elapsedMillis 所要時間（ミリ秒）です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(DMatrixRMaj x, LyapunovResidual residual, double relativeTolerance,
            double threshold, long elapsedMillis) throws IOException {

        Path file = outputDir.resolve(buildFileName("meta", x.numRows));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("n", x.numRows);

            pr.printRecord("solver.relativeTolerance", relativeTolerance);
            pr.printRecord("solver.threshold", threshold);

            pr.printRecord("residual.symmetryDefect", residual.getSymmetryDefect());
            pr.printRecord("residual.norm", residual.getResidualNorm());
            pr.printRecord("residual.relative", residual.getRelativeResidual());

            pr.printRecord("elapsedMillis", elapsedMillis);
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code lyapunov_X_n=10.csv}
     * </p>
     *
     * @param kind 出力の識別子（X/meta）
     * @param dimension 行列の次元です
     * @return ファイル名です
     */
    static String buildFileName(String kind, int dimension) {
        return FILE_HEAD + "_" + kind + "_n=" + dimension + ".csv";
    }
}
