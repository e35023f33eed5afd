package io.github.yok.lyapunov.in;

import org.ejml.data.DMatrixRMaj;

/**
 * 入力ファイルから密行列を読み込む処理のインタフェースです。
 */
public interface MatrixReader {

    /**
     * 行列を読み込みます。
     *
     * @param path 入力ファイルのパスです
     * @return 読み込んだ行列です
     * @throws IllegalArgumentException 入力の形式が不正な場合に発生します
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    DMatrixRMaj read(String path);
}
