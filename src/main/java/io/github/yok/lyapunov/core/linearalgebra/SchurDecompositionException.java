package io.github.yok.lyapunov.core.linearalgebra;

/**
 * 実 Schur 分解が数値的に失敗したことを表す例外です。
 *
 * <p>
 * QR 反復が反復上限までに収束しない場合や、分解結果が準上三角の構造を満たさない場合に発生します。 同じ入力で再試行しても結果は変わらないため、呼び出し側へそのまま伝播させます。
 * </p>
 */
public class SchurDecompositionException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public SchurDecompositionException(String message) {
        super(message);
    }

    /**
     * 原因付きの例外を生成します。
     *
     * @param message 詳細メッセージです
     * @param cause 原因です
     */
    public SchurDecompositionException(String message, Throwable cause) {
        super(message, cause);
    }
}
