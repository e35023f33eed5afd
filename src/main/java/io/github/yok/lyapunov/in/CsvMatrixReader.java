package io.github.yok.lyapunov.in;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.ejml.data.DMatrixRMaj;

/**
 * CSV ファイルから密行列を読み込むクラスです。
 *
 * <p>
 * 1 レコードを行列の 1 行とみなします（ヘッダなし）。 {@code #} で始まる行はコメント、空行は無視します。 全レコードの列数が一致し、全セルが数値として解釈できる必要があります。
 * </p>
 */
public final class CsvMatrixReader implements MatrixReader {

    /**
     * 行列用の CSV 形式です。
     */
    private static final CSVFormat FORMAT = CSVFormat.Builder.create(CSVFormat.DEFAULT)
            .setCommentMarker('#').setIgnoreEmptyLines(true).setTrim(true).build();

    /**
     * CSV ファイルから行列を読み込みます。
     *
     * @param path 入力ファイルのパスです
     * @return 読み込んだ行列です
     * @throws IllegalArgumentException パスが空、レコードがない、列数不一致、数値でないセルがある場合に発生します
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    @Override
    public DMatrixRMaj read(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("入力ファイルのパスは必須です");
        }
        Path file = Paths.get(path);

        List<double[]> rows = new ArrayList<>();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = FORMAT.parse(r)) {

            for (CSVRecord record : parser) {
                rows.add(parseRecord(file, record, rows.isEmpty() ? -1 : rows.get(0).length));
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 読み込みに失敗しました: " + file, e);
        }

        if (rows.isEmpty()) {
            throw new IllegalArgumentException("CSV に行列の成分がありません: " + file);
        }
        return new DMatrixRMaj(rows.toArray(new double[0][]));
    }

    /**
     * 1 レコードを数値の配列に変換します。
     *
     * @param file 入力ファイルです（メッセージ用）
     * @param record レコードです
     * @param expectedColumns 期待する列数です（未確定の場合は -1）
     * @return 数値の配列です
     * @throws IllegalArgumentException 列数不一致または数値でないセルがある場合に発生します
     */
    private static double[] parseRecord(Path file, CSVRecord record, int expectedColumns) {
        int columns = record.size();
        if (expectedColumns >= 0 && columns != expectedColumns) {
            throw new IllegalArgumentException("CSV の列数が一致しません: " + file + "、レコード="
                    + record.getRecordNumber() + "、列数=" + columns + "（期待値 " + expectedColumns + "）");
        }

        double[] values = new double[columns];
        for (int col = 0; col < columns; col++) {
            String cell = record.get(col);
            try {
                values[col] = Double.parseDouble(cell);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("CSV のセルが数値ではありません: " + file + "、レコード="
                        + record.getRecordNumber() + "、列=" + (col + 1) + "、値=" + cell, e);
            }
        }
        return values;
    }
}
