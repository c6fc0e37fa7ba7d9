package com.kotsin.forecast.adapter.sequence;

import com.kotsin.forecast.feature.SlidingWindows;

import java.util.Arrays;
import java.util.Random;

/**
 * LstmNetwork - Stacked LSTM with a small feed-forward head, trained by backpropagation
 * through time.
 *
 * Layout of the flat parameter vector, per layer: W (4H x in), U (4H x H), b (4H), gate
 * order input/forget/cell/output. Head: W1 (K x H), b1 (K), W2 (K), b2 (1).
 *
 * Dropout is applied to the outputs of every LSTM layer except the last, in training only.
 * Forward caches belong to one sample at a time, so an instance is not thread safe.
 */
final class LstmNetwork {

    private final int inputSize;
    private final int hidden;
    private final int layers;
    private final int headSize;
    private final double dropout;
    private final int windowLength;

    private final double[] params;
    private final double[] grads;

    private final int[] wOffset;
    private final int[] uOffset;
    private final int[] bOffset;
    private final int w1Offset;
    private final int b1Offset;
    private final int w2Offset;
    private final int b2Offset;

    // forward caches [layer][step][...]
    private final double[][][] inputs;
    private final double[][][] gates;
    private final double[][][] cells;
    private final double[][][] outputs;
    private final double[][][] masks;
    private final double[] headPre;
    private final double[] headAct;

    LstmNetwork(int inputSize, int hidden, int layers, int headSize, double dropout,
                int windowLength, Random random) {
        this.inputSize = inputSize;
        this.hidden = hidden;
        this.layers = layers;
        this.headSize = headSize;
        this.dropout = dropout;
        this.windowLength = windowLength;

        wOffset = new int[layers];
        uOffset = new int[layers];
        bOffset = new int[layers];
        int offset = 0;
        for (int l = 0; l < layers; l++) {
            wOffset[l] = offset;
            offset += 4 * hidden * layerInput(l);
            uOffset[l] = offset;
            offset += 4 * hidden * hidden;
            bOffset[l] = offset;
            offset += 4 * hidden;
        }
        w1Offset = offset;
        offset += headSize * hidden;
        b1Offset = offset;
        offset += headSize;
        w2Offset = offset;
        offset += headSize;
        b2Offset = offset;
        offset += 1;

        params = new double[offset];
        grads = new double[offset];
        initialize(random);

        inputs = new double[layers][windowLength][];
        gates = new double[layers][windowLength][4 * hidden];
        cells = new double[layers][windowLength][hidden];
        outputs = new double[layers][windowLength][hidden];
        masks = new double[layers][windowLength][hidden];
        for (int l = 0; l < layers; l++) {
            for (int t = 0; t < windowLength; t++) {
                inputs[l][t] = new double[layerInput(l)];
            }
        }
        headPre = new double[headSize];
        headAct = new double[headSize];
    }

    private int layerInput(int layer) {
        return layer == 0 ? inputSize : hidden;
    }

    /**
     * Uniform(-1/sqrt(fan), 1/sqrt(fan)) initialization, as the usual LSTM and Linear defaults.
     */
    private void initialize(Random random) {
        double lstmBound = 1.0 / Math.sqrt(hidden);
        for (int i = 0; i < w1Offset; i++) {
            params[i] = uniform(random, lstmBound);
        }
        double headBound = 1.0 / Math.sqrt(hidden);
        for (int i = w1Offset; i < w2Offset; i++) {
            params[i] = uniform(random, headBound);
        }
        double outBound = 1.0 / Math.sqrt(headSize);
        for (int i = w2Offset; i < params.length; i++) {
            params[i] = uniform(random, outBound);
        }
    }

    private static double uniform(Random random, double bound) {
        return (random.nextDouble() * 2 - 1) * bound;
    }

    double[] parameters() {
        return params;
    }

    double[] gradients() {
        return grads;
    }

    int parameterCount() {
        return params.length;
    }

    void zeroGradients() {
        Arrays.fill(grads, 0.0);
    }

    // ======================== FORWARD ========================

    /**
     * Next-step prediction for one window. With {@code training} set, dropout masks are drawn
     * from {@code random} and caches are kept for {@link #backward}.
     */
    double forward(SlidingWindows windows, int window, boolean training, Random random) {
        for (int t = 0; t < windowLength; t++) {
            double[] x = inputs[0][t];
            for (int f = 0; f < inputSize; f++) {
                x[f] = windows.value(window, t, f);
            }
        }

        for (int l = 0; l < layers; l++) {
            int in = layerInput(l);
            double[] hPrev = new double[hidden];
            double[] cPrev = new double[hidden];
            for (int t = 0; t < windowLength; t++) {
                double[] x = inputs[l][t];
                double[] a = gates[l][t];
                for (int r = 0; r < 4 * hidden; r++) {
                    double sum = params[bOffset[l] + r];
                    int wRow = wOffset[l] + r * in;
                    for (int k = 0; k < in; k++) {
                        sum += params[wRow + k] * x[k];
                    }
                    int uRow = uOffset[l] + r * hidden;
                    for (int k = 0; k < hidden; k++) {
                        sum += params[uRow + k] * hPrev[k];
                    }
                    a[r] = sum;
                }
                double[] c = cells[l][t];
                double[] h = outputs[l][t];
                for (int j = 0; j < hidden; j++) {
                    double i = sigmoid(a[j]);
                    double f = sigmoid(a[hidden + j]);
                    double g = Math.tanh(a[2 * hidden + j]);
                    double o = sigmoid(a[3 * hidden + j]);
                    a[j] = i;
                    a[hidden + j] = f;
                    a[2 * hidden + j] = g;
                    a[3 * hidden + j] = o;
                    c[j] = f * cPrev[j] + i * g;
                    h[j] = o * Math.tanh(c[j]);
                }
                hPrev = h;
                cPrev = c;
            }

            if (l < layers - 1) {
                double keep = 1.0 - dropout;
                for (int t = 0; t < windowLength; t++) {
                    double[] mask = masks[l][t];
                    double[] next = inputs[l + 1][t];
                    double[] h = outputs[l][t];
                    for (int j = 0; j < hidden; j++) {
                        mask[j] = !training || dropout <= 0.0 ? 1.0
                                : (random.nextDouble() < keep ? 1.0 / keep : 0.0);
                        next[j] = h[j] * mask[j];
                    }
                }
            }
        }

        double[] top = outputs[layers - 1][windowLength - 1];
        double out = params[b2Offset];
        for (int k = 0; k < headSize; k++) {
            double sum = params[b1Offset + k];
            int row = w1Offset + k * hidden;
            for (int j = 0; j < hidden; j++) {
                sum += params[row + j] * top[j];
            }
            headPre[k] = sum;
            headAct[k] = Math.max(0.0, sum);
            out += params[w2Offset + k] * headAct[k];
        }
        return out;
    }

    // ======================== BACKWARD ========================

    /**
     * Accumulate gradients of the last {@link #forward} call given dLoss/dOutput.
     */
    void backward(double dOut) {
        double[] top = outputs[layers - 1][windowLength - 1];
        double[] dTop = new double[hidden];
        grads[b2Offset] += dOut;
        for (int k = 0; k < headSize; k++) {
            grads[w2Offset + k] += dOut * headAct[k];
            double dPre = headPre[k] > 0.0 ? dOut * params[w2Offset + k] : 0.0;
            if (dPre == 0.0) {
                continue;
            }
            grads[b1Offset + k] += dPre;
            int row = w1Offset + k * hidden;
            for (int j = 0; j < hidden; j++) {
                grads[row + j] += dPre * top[j];
                dTop[j] += dPre * params[row + j];
            }
        }

        double[][] dAbove = new double[windowLength][];
        dAbove[windowLength - 1] = dTop;
        double[] zeros = new double[hidden];
        double[] da = new double[4 * hidden];

        for (int l = layers - 1; l >= 0; l--) {
            int in = layerInput(l);
            double[][] dInputs = l > 0 ? new double[windowLength][in] : null;
            double[] dhNext = new double[hidden];
            double[] dcNext = new double[hidden];

            for (int t = windowLength - 1; t >= 0; t--) {
                double[] g4 = gates[l][t];
                double[] c = cells[l][t];
                double[] cPrev = t > 0 ? cells[l][t - 1] : zeros;
                double[] hPrev = t > 0 ? outputs[l][t - 1] : zeros;
                double[] above = dAbove[t];

                for (int j = 0; j < hidden; j++) {
                    double dh = dhNext[j] + (above == null ? 0.0 : above[j]);
                    double i = g4[j];
                    double f = g4[hidden + j];
                    double g = g4[2 * hidden + j];
                    double o = g4[3 * hidden + j];
                    double tanhC = Math.tanh(c[j]);
                    double dc = dh * o * (1 - tanhC * tanhC) + dcNext[j];
                    da[j] = dc * g * i * (1 - i);
                    da[hidden + j] = dc * cPrev[j] * f * (1 - f);
                    da[2 * hidden + j] = dc * i * (1 - g * g);
                    da[3 * hidden + j] = dh * tanhC * o * (1 - o);
                    dcNext[j] = dc * f;
                }

                double[] x = inputs[l][t];
                Arrays.fill(dhNext, 0.0);
                for (int r = 0; r < 4 * hidden; r++) {
                    double d = da[r];
                    if (d == 0.0) {
                        continue;
                    }
                    grads[bOffset[l] + r] += d;
                    int wRow = wOffset[l] + r * in;
                    for (int k = 0; k < in; k++) {
                        grads[wRow + k] += d * x[k];
                    }
                    if (dInputs != null) {
                        double[] dx = dInputs[t];
                        for (int k = 0; k < in; k++) {
                            dx[k] += d * params[wRow + k];
                        }
                    }
                    int uRow = uOffset[l] + r * hidden;
                    for (int k = 0; k < hidden; k++) {
                        grads[uRow + k] += d * hPrev[k];
                        dhNext[k] += d * params[uRow + k];
                    }
                }
            }

            if (l > 0) {
                double[][] below = new double[windowLength][];
                for (int t = 0; t < windowLength; t++) {
                    double[] mask = masks[l - 1][t];
                    double[] dx = dInputs[t];
                    for (int j = 0; j < hidden; j++) {
                        dx[j] *= mask[j];
                    }
                    below[t] = dx;
                }
                dAbove = below;
            }
        }
    }

    private static double sigmoid(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }
}
