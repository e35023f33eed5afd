package io.github.yok.lyapunov.core.linearalgebra;

import com.google.common.base.Preconditions;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.decomposition.hessenberg.HessenbergSimilarDecomposition_DDRM;

/**
 * EJML の Hessenberg 分解と Francis 二重シフト QR 反復を用いて、実 Schur 分解を行うクラスです。
 *
 * <p>
 * EJML で {@code A = Q0 H Q0^T} に変換した後、H に対して陰的二重シフト QR 反復を行い、 直交変換を Q0 に累積して U とします。 実固有値の対を持つ 2×2
 * ブロックは Givens 回転で 2 つの 1×1 ブロックに分割するため、 結果の 2×2 ブロックは複素共役固有値対に対応します。
 * </p>
 */
@Slf4j
public final class EjmlRealSchurDecompositionBackend implements RealSchurDecompositionBackend {

    /**
     * 既定の反復上限係数です（反復総数の上限は {@code 係数 * max(10, n)} です）。
     */
    public static final int DEFAULT_MAX_ITERATIONS_PER_EIGENVALUE = 30;

    /**
     * 倍精度の丸め単位です。
     */
    private static final double EPS = Math.ulp(1.0);

    /**
     * 反復上限係数です。
     */
    @Getter
    private final int maxIterationsPerEigenvalue;

    /**
     * 既定の反復上限で生成します。
     */
    public EjmlRealSchurDecompositionBackend() {
        this(DEFAULT_MAX_ITERATIONS_PER_EIGENVALUE);
    }

    /**
     * 反復上限を指定して生成します。
     *
     * @param maxIterationsPerEigenvalue 反復上限係数です（1 以上）
     * @throws IllegalArgumentException 反復上限係数が 1 未満の場合に発生します
     */
    public EjmlRealSchurDecompositionBackend(int maxIterationsPerEigenvalue) {
        Preconditions.checkArgument(maxIterationsPerEigenvalue >= 1,
                "maxIterationsPerEigenvalue は 1 以上が必要です: %s", maxIterationsPerEigenvalue);
        this.maxIterationsPerEigenvalue = maxIterationsPerEigenvalue;
    }

    /**
     * 実正方行列を実 Schur 分解します。
     *
     * @param matrix 実正方行列です（変更されません）
     * @return 実 Schur 分解の結果です
     * @throws IllegalArgumentException matrix が null、または正方でない場合に発生します
     * @throws SchurDecompositionException Hessenberg 分解または QR 反復に失敗した場合に発生します
     */
    @Override
    public RealSchurResult decompose(DMatrixRMaj matrix) {
        Preconditions.checkArgument(matrix != null, "matrix は null 不可です");
        Preconditions.checkArgument(matrix.numRows == matrix.numCols, "matrix は正方行列が必要です: %sx%s",
                matrix.numRows, matrix.numCols);

        int n = matrix.numRows;

        // 1) Hessenberg 形への相似変換（EJML）
        HessenbergSimilarDecomposition_DDRM hessenberg = new HessenbergSimilarDecomposition_DDRM(n);
        if (!hessenberg.decompose(matrix.copy())) {
            throw new SchurDecompositionException("Hessenberg 分解に失敗しました（EJML）");
        }

        double[][] h = toArray(hessenberg.getH(null));
        double[][] v = toArray(hessenberg.getQ(null));

        // EJML の H は第一副対角より下が 0 の前提ですが、念のため厳密に 0 にします。
        for (int i = 2; i < n; i++) {
            for (int j = 0; j < i - 1; j++) {
                h[i][j] = 0.0;
            }
        }

        // 2) Francis 二重シフト QR 反復で準上三角形へ
        int iterations = reduceToRealSchurForm(h, v);

        log.debug("実 Schur 分解が完了しました。次元={}、QR 反復回数={}", n, iterations);

        return new RealSchurResult(toMatrix(h), toMatrix(v));
    }

    /**
     * Hessenberg 行列 h を実 Schur 形に変換し、直交変換を v に累積します。
     *
     * <p>
     * 下端から固有値を 1 つ（実固有値）または 2 つ（2×2 ブロック）ずつ収束させます。 収束判定を満たした副対角成分は 0 に置き換えます。
     * </p>
     *
     * @param h Hessenberg 行列です（実 Schur 形に上書きされます）
     * @param v 累積する直交行列です（上書きされます）
     * @return 実行した QR ステップの総数です
     * @throws SchurDecompositionException 反復上限までに収束しない場合に発生します
     */
    private int reduceToRealSchurForm(double[][] h, double[][] v) {
        int nn = h.length;
        int maxTotalIterations = maxIterationsPerEigenvalue * Math.max(10, nn);

        double norm = 0.0;
        for (int i = 0; i < nn; i++) {
            for (int j = Math.max(i - 1, 0); j < nn; j++) {
                norm += Math.abs(h[i][j]);
            }
        }

        int n = nn - 1;
        int iter = 0;
        int totalIterations = 0;
        double exshift = 0.0;
        double p = 0.0;
        double q = 0.0;
        double r = 0.0;
        double s;
        double w;
        double x;
        double y;
        double z;

        while (n >= 0) {
            // 下端側から、十分小さい副対角成分を探します。
            int l = n;
            while (l > 0) {
                s = Math.abs(h[l - 1][l - 1]) + Math.abs(h[l][l]);
                if (s == 0.0) {
                    s = norm;
                }
                if (Math.abs(h[l][l - 1]) <= EPS * s) {
                    break;
                }
                l--;
            }
            if (l > 0) {
                h[l][l - 1] = 0.0;
            }

            if (l == n) {
                // 1×1 ブロックが収束
                h[n][n] += exshift;
                n--;
                iter = 0;
            } else if (l == n - 1) {
                // 2×2 ブロックが収束
                w = h[n][n - 1] * h[n - 1][n];
                p = (h[n - 1][n - 1] - h[n][n]) / 2.0;
                q = p * p + w;
                z = Math.sqrt(Math.abs(q));
                h[n][n] += exshift;
                h[n - 1][n - 1] += exshift;
                x = h[n][n];

                if (q >= 0.0) {
                    // 実固有値の対は回転で 1×1 ブロック 2 つに分割します。
                    z = (p >= 0.0) ? p + z : p - z;
                    x = h[n][n - 1];
                    s = Math.abs(x) + Math.abs(z);
                    p = x / s;
                    q = z / s;
                    r = Math.sqrt(p * p + q * q);
                    p /= r;
                    q /= r;

                    for (int j = n - 1; j < nn; j++) {
                        z = h[n - 1][j];
                        h[n - 1][j] = q * z + p * h[n][j];
                        h[n][j] = q * h[n][j] - p * z;
                    }
                    for (int i = 0; i <= n; i++) {
                        z = h[i][n - 1];
                        h[i][n - 1] = q * z + p * h[i][n];
                        h[i][n] = q * h[i][n] - p * z;
                    }
                    for (int i = 0; i < nn; i++) {
                        z = v[i][n - 1];
                        v[i][n - 1] = q * z + p * v[i][n];
                        v[i][n] = q * v[i][n] - p * z;
                    }
                    h[n][n - 1] = 0.0;
                }
                n -= 2;
                iter = 0;
            } else {
                if (totalIterations >= maxTotalIterations) {
                    throw new SchurDecompositionException("実 Schur 分解の QR 反復が収束しませんでした（未収束の固有値 index="
                            + n + "、反復回数=" + totalIterations + "）");
                }

                x = h[n][n];
                y = h[n - 1][n - 1];
                w = h[n][n - 1] * h[n - 1][n];

                // 停滞時の例外シフト（10 回目）
                if (iter == 10) {
                    exshift += x;
                    for (int i = 0; i <= n; i++) {
                        h[i][i] -= x;
                    }
                    s = Math.abs(h[n][n - 1]) + Math.abs(h[n - 1][n - 2]);
                    x = 0.75 * s;
                    y = x;
                    w = -0.4375 * s * s;
                }

                // 停滞時の例外シフト（30 回目）
                if (iter == 30) {
                    s = (y - x) / 2.0;
                    s = s * s + w;
                    if (s > 0) {
                        s = Math.sqrt(s);
                        if (y < x) {
                            s = -s;
                        }
                        s = x - w / ((y - x) / 2.0 + s);
                        for (int i = 0; i <= n; i++) {
                            h[i][i] -= s;
                        }
                        exshift += s;
                        x = 0.964;
                        y = x;
                        w = x;
                    }
                }

                iter++;
                totalIterations++;

                // 連続する 2 つの小さい副対角成分を探し、バルジの開始位置 m を決めます。
                int m = n - 2;
                while (m >= l) {
                    z = h[m][m];
                    r = x - z;
                    s = y - z;
                    p = (r * s - w) / h[m + 1][m] + h[m][m + 1];
                    q = h[m + 1][m + 1] - z - r - s;
                    r = h[m + 2][m + 1];
                    s = Math.abs(p) + Math.abs(q) + Math.abs(r);
                    p /= s;
                    q /= s;
                    r /= s;
                    if (m == l) {
                        break;
                    }
                    if (Math.abs(h[m][m - 1]) * (Math.abs(q) + Math.abs(r)) < EPS
                            * (Math.abs(p) * (Math.abs(h[m - 1][m - 1]) + Math.abs(z)
                                    + Math.abs(h[m + 1][m + 1])))) {
                        break;
                    }
                    m--;
                }

                for (int i = m + 2; i <= n; i++) {
                    h[i][i - 2] = 0.0;
                    if (i > m + 2) {
                        h[i][i - 3] = 0.0;
                    }
                }

                doubleShiftSweep(h, v, l, m, n, p, q, r);
            }
        }
        return totalIterations;
    }

    /**
     * 行 l..n、列 m..n を対象に、Householder 反射による二重シフト QR ステップ（バルジ追跡）を 1 回実行します。
     *
     * @param h 対象行列です（上書きされます）
     * @param v 累積する直交行列です（上書きされます）
     * @param l 非縮退ウィンドウの先頭 index です
     * @param m バルジの開始 index です
     * @param n 非縮退ウィンドウの末尾 index です
     * @param p0 最初の反射ベクトルの第 1 成分です
     * @param q0 最初の反射ベクトルの第 2 成分です
     * @param r0 最初の反射ベクトルの第 3 成分です
     */
    private static void doubleShiftSweep(double[][] h, double[][] v, int l, int m, int n,
            double p0, double q0, double r0) {
        int nn = h.length;
        double p = p0;
        double q = q0;
        double r = r0;
        double x = 0.0;
        double y;
        double z;
        double s;

        for (int k = m; k <= n - 1; k++) {
            boolean notLast = (k != n - 1);
            if (k != m) {
                p = h[k][k - 1];
                q = h[k + 1][k - 1];
                r = notLast ? h[k + 2][k - 1] : 0.0;
                x = Math.abs(p) + Math.abs(q) + Math.abs(r);
                if (x == 0.0) {
                    continue;
                }
                p /= x;
                q /= x;
                r /= x;
            }

            s = Math.sqrt(p * p + q * q + r * r);
            if (p < 0) {
                s = -s;
            }
            if (s == 0.0) {
                continue;
            }

            if (k != m) {
                // 追跡済みのバルジは反射で消えるため、残り成分も 0 にします。
                h[k][k - 1] = -s * x;
                h[k + 1][k - 1] = 0.0;
                if (notLast) {
                    h[k + 2][k - 1] = 0.0;
                }
            } else if (l != m) {
                h[k][k - 1] = -h[k][k - 1];
            }
            p += s;
            x = p / s;
            y = q / s;
            z = r / s;
            q /= p;
            r /= p;

            // 行の更新
            for (int j = k; j < nn; j++) {
                p = h[k][j] + q * h[k + 1][j];
                if (notLast) {
                    p += r * h[k + 2][j];
                    h[k + 2][j] -= p * z;
                }
                h[k][j] -= p * x;
                h[k + 1][j] -= p * y;
            }

            // 列の更新
            for (int i = 0; i <= Math.min(n, k + 3); i++) {
                p = x * h[i][k] + y * h[i][k + 1];
                if (notLast) {
                    p += z * h[i][k + 2];
                    h[i][k + 2] -= p * r;
                }
                h[i][k] -= p;
                h[i][k + 1] -= p * q;
            }

            // 直交変換の累積
            for (int i = 0; i < nn; i++) {
                p = x * v[i][k] + y * v[i][k + 1];
                if (notLast) {
                    p += z * v[i][k + 2];
                    v[i][k + 2] -= p * r;
                }
                v[i][k] -= p;
                v[i][k + 1] -= p * q;
            }
        }
    }

    /**
     * EJML の行列を 2 次元配列にコピーします。
     *
     * @param m 行列です
     * @return 2 次元配列です
     */
    private static double[][] toArray(DMatrixRMaj m) {
        double[][] a = new double[m.numRows][m.numCols];
        for (int i = 0; i < m.numRows; i++) {
            for (int j = 0; j < m.numCols; j++) {
                a[i][j] = m.get(i, j);
            }
        }
        return a;
    }

    /**
     * 2 次元配列を EJML の行列にコピーします。
     *
     * @param a 2 次元配列です
     * @return 行列です
     */
    private static DMatrixRMaj toMatrix(double[][] a) {
        return new DMatrixRMaj(a);
    }
}
