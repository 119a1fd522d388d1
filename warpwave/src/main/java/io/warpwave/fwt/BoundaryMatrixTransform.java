//
//   Copyright 2021  SenX S.A.S.
//
//   Licensed under the Apache License, Version 2.0 (the "License");
//   you may not use this file except in compliance with the License.
//   You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
//   Unless required by applicable law or agreed to in writing, software
//   distributed under the License is distributed on an "AS IS" BASIS,
//   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
//   See the License for the specific language governing permissions and
//   limitations under the License.
//

package io.warpwave.fwt;

import io.warpwave.Configuration;
import io.warpwave.WarpWaveConfig;
import io.warpwave.WaveletConfigurationException;
import io.warpwave.tensor.Tensor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Single level wavelet transform computed with orthogonal matrices instead of
 * padded convolutions.
 *
 * The analysis matrix of a signal of length n stacks n/2 low pass rows over n/2
 * high pass rows, each row being the decomposition filter shifted by two
 * samples. Rows whose filter sticks out of the signal are truncated and then
 * orthonormalized with a QR decomposition, which keeps the matrix orthogonal so
 * its transpose is the exact inverse. Odd lengths get a trailing zero.
 *
 * Matrices are cached per length, an instance is meant to be reused for all the
 * transforms performed with the same filter bank.
 */
public class BoundaryMatrixTransform {

  private static final Logger LOG = LoggerFactory.getLogger(BoundaryMatrixTransform.class);

  /**
   * Smallest acceptable |R[i][i]| when orthonormalizing boundary rows
   */
  private static final double RANK_TOLERANCE = 1e-10D;

  private final FilterBank bank;

  private final Map<Integer, RealMatrix> analysis = new HashMap<Integer, RealMatrix>();
  private final Map<Integer, RealMatrix> synthesis = new HashMap<Integer, RealMatrix>();

  public BoundaryMatrixTransform(FilterBank bank) {
    this(bank, WarpWaveConfig.getDoubleProperty(Configuration.FWT_BOUNDARY_TOLERANCE, Configuration.DEFAULT_FWT_BOUNDARY_TOLERANCE));
  }

  public BoundaryMatrixTransform(FilterBank bank, double tolerance) {
    Preconditions.checkNotNull(bank);

    if (!bank.isOrthogonal(tolerance)) {
      throw new WaveletConfigurationException("Boundary mode needs an orthogonal filter bank, '" + bank.getName() + "' is not.");
    }

    this.bank = bank;
  }

  public FilterBank getFilterBank() {
    return bank;
  }

  /**
   * @param length even signal length
   */
  public synchronized RealMatrix getAnalysisMatrix(int length) {
    Preconditions.checkArgument(length > 0 && 0 == length % 2, "Boundary matrices need an even positive length, got %s.", length);

    RealMatrix matrix = analysis.get(length);

    if (null == matrix) {
      matrix = construct(bank.decLo(), bank.decHi(), length);
      analysis.put(length, matrix);
    }

    return matrix;
  }

  public synchronized RealMatrix getSynthesisMatrix(int length) {
    RealMatrix matrix = synthesis.get(length);

    if (null == matrix) {
      matrix = getAnalysisMatrix(length).transpose();
      synthesis.put(length, matrix);
    }

    return matrix;
  }

  /**
   * @return approximation and detail coefficients, each of length ceil(n / 2)
   */
  public Tensor[] forward(Tensor data, int axis) {
    int len = data.size(axis);
    int even = len + (len % 2);

    RealMatrix matrix = getAnalysisMatrix(even);

    Tensor both = data.mapLines(axis, even, (in, out) -> {
      double[] x = in;
      if (in.length != even) {
        x = new double[even];
        System.arraycopy(in, 0, x, 0, in.length);
      }
      double[] y = matrix.operate(x);
      System.arraycopy(y, 0, out, 0, even);
    });

    return new Tensor[] { both.narrow(axis, 0, even / 2), both.narrow(axis, even / 2, even / 2) };
  }

  /**
   * @param target length of the reconstructed signal, 2n - 1 drops the trailing sample, -1 keeps 2n
   */
  public Tensor inverse(Tensor lo, Tensor hi, int axis, int target) {
    int len = lo.size(axis);
    int even = 2 * len;

    Preconditions.checkArgument(target < 0 || target == even || target == even - 1, "Coefficients of length %s cannot produce a signal of length %s.", len, target);

    RealMatrix matrix = getSynthesisMatrix(even);

    Tensor rec = Tensor.combineLines(lo, hi, axis, even, (a, d, out) -> {
      double[] coeffs = new double[even];
      System.arraycopy(a, 0, coeffs, 0, len);
      System.arraycopy(d, 0, coeffs, len, len);
      double[] x = matrix.operate(coeffs);
      System.arraycopy(x, 0, out, 0, even);
    });

    if (even - 1 == target) {
      rec = rec.narrow(axis, 0, target);
    }

    return rec;
  }

  /**
   * Builds the strided filter matrix and orthonormalizes its truncated rows.
   */
  static RealMatrix construct(double[] decLo, double[] decHi, int length) {
    int filterLength = decLo.length;
    int half = length / 2;

    // Centers the support of row k on samples 2k and 2k + 1
    int offset = filterLength / 2 - 1;

    RealMatrix matrix = MatrixUtils.createRealMatrix(length, length);
    List<Integer> truncated = new ArrayList<Integer>();

    double[][] filters = new double[][] { decLo, decHi };

    for (int f = 0; f < 2; f++) {
      for (int k = 0; k < half; k++) {
        int row = f * half + k;
        int inside = 0;

        for (int j = 0; j < filterLength; j++) {
          int col = 2 * k + 1 + offset - j;
          if (col >= 0 && col < length) {
            matrix.addToEntry(row, col, filters[f][j]);
            inside++;
          }
        }

        if (inside < filterLength) {
          truncated.add(row);
        }
      }
    }

    if (!truncated.isEmpty()) {
      orthogonalize(matrix, truncated);
    }

    if (LOG.isDebugEnabled()) {
      LOG.debug("Built boundary matrix for length " + length + ", " + truncated.size() + " rows orthogonalized.");
    }

    return matrix;
  }

  private static void orthogonalize(RealMatrix matrix, List<Integer> rows) {
    int length = matrix.getColumnDimension();

    RealMatrix columns = MatrixUtils.createRealMatrix(length, rows.size());

    for (int c = 0; c < rows.size(); c++) {
      columns.setColumn(c, matrix.getRow(rows.get(c)));
    }

    QRDecomposition qr = new QRDecomposition(columns);
    RealMatrix q = qr.getQ();
    RealMatrix r = qr.getR();

    for (int c = 0; c < rows.size(); c++) {
      if (Math.abs(r.getEntry(c, c)) < RANK_TOLERANCE) {
        throw new WaveletConfigurationException("Boundary rows are linearly dependent for a signal of length " + length + ".");
      }
    }

    for (int c = 0; c < rows.size(); c++) {
      matrix.setRow(rows.get(c), q.getColumn(c));
    }
  }
}
