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

package io.warpwave.tensor;

import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Dense row-major array of numbers with an arbitrary number of dimensions.
 *
 * Tensors are immutable, every operation returns a new instance. Values of
 * FLOAT32 tensors are rounded to single precision when stored.
 */
public final class Tensor {

  /**
   * Transforms one line of values taken along an axis.
   */
  @FunctionalInterface
  public interface LineFunction {
    void apply(double[] in, double[] out);
  }

  /**
   * Combines two lines of values taken at the same position along an axis.
   */
  @FunctionalInterface
  public interface BinaryLineFunction {
    void apply(double[] in1, double[] in2, double[] out);
  }

  private final int[] shape;
  private final double[] data;
  private final DType dtype;

  private Tensor(int[] shape, double[] data, DType dtype) {
    this.shape = shape;
    this.data = data;
    this.dtype = dtype;

    if (DType.FLOAT64 != dtype) {
      for (int i = 0; i < data.length; i++) {
        data[i] = dtype.round(data[i]);
      }
    }
  }

  public static Tensor create(DType dtype, int[] shape, double[] data) {
    Preconditions.checkNotNull(dtype);
    Preconditions.checkArgument(numel(shape) == data.length, "Shape %s does not match %s values.", Arrays.toString(shape), data.length);
    return new Tensor(shape.clone(), data.clone(), dtype);
  }

  public static Tensor zeros(DType dtype, int... shape) {
    return new Tensor(shape.clone(), new double[numel(shape)], dtype);
  }

  public static Tensor of(double... values) {
    return of(DType.FLOAT64, values);
  }

  public static Tensor of(DType dtype, double... values) {
    return new Tensor(new int[] { values.length }, values.clone(), dtype);
  }

  public static Tensor of(double[][] values) {
    return of(DType.FLOAT64, values);
  }

  public static Tensor of(DType dtype, double[][] values) {
    int cols = 0 == values.length ? 0 : values[0].length;
    double[] data = new double[values.length * cols];

    for (int i = 0; i < values.length; i++) {
      Preconditions.checkArgument(cols == values[i].length, "Ragged 2D array.");
      System.arraycopy(values[i], 0, data, i * cols, cols);
    }

    return new Tensor(new int[] { values.length, cols }, data, dtype);
  }

  public static Tensor of(double[][][] values) {
    return of(DType.FLOAT64, values);
  }

  public static Tensor of(DType dtype, double[][][] values) {
    Tensor[] planes = new Tensor[values.length];

    for (int i = 0; i < values.length; i++) {
      planes[i] = of(dtype, values[i]);
    }

    return stack(Arrays.asList(planes));
  }

  public DType dtype() {
    return dtype;
  }

  public int[] shape() {
    return shape.clone();
  }

  public int dim() {
    return shape.length;
  }

  /**
   * Size along an axis, negative axes count from the end.
   */
  public int size(int axis) {
    return shape[axis(axis)];
  }

  public int numel() {
    return data.length;
  }

  public double get(int... index) {
    Preconditions.checkArgument(index.length == shape.length, "Expected %s indices, got %s.", shape.length, index.length);

    int offset = 0;

    for (int i = 0; i < shape.length; i++) {
      int idx = index[i] < 0 ? index[i] + shape[i] : index[i];
      Preconditions.checkElementIndex(idx, shape[i]);
      offset = offset * shape[i] + idx;
    }

    return data[offset];
  }

  /**
   * @return the only value of a single element tensor
   */
  public double item() {
    Preconditions.checkState(1 == data.length, "item() needs a single element tensor, shape is %s.", Arrays.toString(shape));
    return data[0];
  }

  /**
   * @return a copy of the values in row-major order
   */
  public double[] toArray() {
    return data.clone();
  }

  public Tensor to(DType target) {
    if (target == dtype) {
      return this;
    }
    return new Tensor(shape.clone(), data.clone(), target);
  }

  public Tensor reshape(int... newShape) {
    Preconditions.checkArgument(numel(newShape) == data.length, "Cannot reshape %s into %s.", Arrays.toString(shape), Arrays.toString(newShape));
    return new Tensor(newShape.clone(), data.clone(), dtype);
  }

  /**
   * Removes the dimensions of size 1.
   */
  public Tensor squeeze() {
    int[] newShape = Arrays.stream(shape).filter(s -> 1 != s).toArray();
    return new Tensor(newShape, data.clone(), dtype);
  }

  /**
   * Adds a dimension of size 1 at the given position.
   */
  public Tensor unsqueeze(int axis) {
    int ax = axis < 0 ? axis + shape.length + 1 : axis;
    Preconditions.checkElementIndex(ax, shape.length + 1);

    int[] newShape = new int[shape.length + 1];
    System.arraycopy(shape, 0, newShape, 0, ax);
    newShape[ax] = 1;
    System.arraycopy(shape, ax, newShape, ax + 1, shape.length - ax);

    return new Tensor(newShape, data.clone(), dtype);
  }

  /**
   * Keeps 'length' elements along 'axis', starting at 'start'.
   */
  public Tensor narrow(int axis, int start, int length) {
    int ax = axis(axis);
    Preconditions.checkArgument(start >= 0 && length >= 0 && start + length <= shape[ax], "Cannot narrow [%s,%s[ on an axis of size %s.", start, start + length, shape[ax]);

    int outer = numel(shape, 0, ax);
    int inner = numel(shape, ax + 1, shape.length);

    int[] newShape = shape.clone();
    newShape[ax] = length;

    double[] out = new double[outer * length * inner];

    for (int o = 0; o < outer; o++) {
      System.arraycopy(data, (o * shape[ax] + start) * inner, out, o * length * inner, length * inner);
    }

    return new Tensor(newShape, out, dtype);
  }

  /**
   * Applies a function to every line of values along an axis.
   *
   * @param outLength size of the axis in the result
   */
  public Tensor mapLines(int axis, int outLength, LineFunction fn) {
    int ax = axis(axis);
    int n = shape[ax];
    int outer = numel(shape, 0, ax);
    int inner = numel(shape, ax + 1, shape.length);

    int[] newShape = shape.clone();
    newShape[ax] = outLength;

    double[] out = new double[outer * outLength * inner];
    double[] line = new double[n];
    double[] result = new double[outLength];

    for (int o = 0; o < outer; o++) {
      for (int i = 0; i < inner; i++) {
        for (int t = 0; t < n; t++) {
          line[t] = data[(o * n + t) * inner + i];
        }
        Arrays.fill(result, 0.0D);
        fn.apply(line, result);
        for (int t = 0; t < outLength; t++) {
          out[(o * outLength + t) * inner + i] = result[t];
        }
      }
    }

    return new Tensor(newShape, out, dtype);
  }

  /**
   * Combines the lines of two tensors of identical shapes along an axis.
   */
  public static Tensor combineLines(Tensor t1, Tensor t2, int axis, int outLength, BinaryLineFunction fn) {
    Preconditions.checkArgument(Arrays.equals(t1.shape, t2.shape), "Shape mismatch, %s vs %s.", Arrays.toString(t1.shape), Arrays.toString(t2.shape));

    int ax = t1.axis(axis);
    int n = t1.shape[ax];
    int outer = numel(t1.shape, 0, ax);
    int inner = numel(t1.shape, ax + 1, t1.shape.length);

    int[] newShape = t1.shape.clone();
    newShape[ax] = outLength;

    double[] out = new double[outer * outLength * inner];
    double[] line1 = new double[n];
    double[] line2 = new double[n];
    double[] result = new double[outLength];

    for (int o = 0; o < outer; o++) {
      for (int i = 0; i < inner; i++) {
        for (int t = 0; t < n; t++) {
          line1[t] = t1.data[(o * n + t) * inner + i];
          line2[t] = t2.data[(o * n + t) * inner + i];
        }
        Arrays.fill(result, 0.0D);
        fn.apply(line1, line2, result);
        for (int t = 0; t < outLength; t++) {
          out[(o * outLength + t) * inner + i] = result[t];
        }
      }
    }

    return new Tensor(newShape, out, widest(t1.dtype, t2.dtype));
  }

  /**
   * Concatenates tensors along an existing axis, the other dimensions must agree.
   */
  public static Tensor cat(int axis, List<Tensor> tensors) {
    Preconditions.checkArgument(!tensors.isEmpty(), "Nothing to concatenate.");

    Tensor first = tensors.get(0);
    int ax = first.axis(axis);
    int outer = numel(first.shape, 0, ax);
    int inner = numel(first.shape, ax + 1, first.shape.length);

    int total = 0;
    DType dtype = first.dtype;

    for (Tensor t : tensors) {
      Preconditions.checkArgument(t.shape.length == first.shape.length, "Cannot concatenate tensors of different ranks.");
      for (int i = 0; i < first.shape.length; i++) {
        Preconditions.checkArgument(i == ax || t.shape[i] == first.shape[i], "Cannot concatenate %s and %s along axis %s.", Arrays.toString(first.shape), Arrays.toString(t.shape), axis);
      }
      total += t.shape[ax];
      dtype = widest(dtype, t.dtype);
    }

    int[] newShape = first.shape.clone();
    newShape[ax] = total;

    double[] out = new double[outer * total * inner];

    for (int o = 0; o < outer; o++) {
      int offset = o * total * inner;
      for (Tensor t : tensors) {
        int chunk = t.shape[ax] * inner;
        System.arraycopy(t.data, o * chunk, out, offset, chunk);
        offset += chunk;
      }
    }

    return new Tensor(newShape, out, dtype);
  }

  public static Tensor cat(int axis, Tensor... tensors) {
    return cat(axis, Arrays.asList(tensors));
  }

  /**
   * Stacks tensors of identical shapes along a new leading axis.
   */
  public static Tensor stack(List<Tensor> tensors) {
    Preconditions.checkArgument(!tensors.isEmpty(), "Nothing to stack.");

    int[] shape = tensors.get(0).shape;
    int[] newShape = new int[shape.length + 1];
    newShape[0] = tensors.size();
    System.arraycopy(shape, 0, newShape, 1, shape.length);

    int n = numel(shape);
    double[] out = new double[n * tensors.size()];
    DType dtype = tensors.get(0).dtype;

    for (int i = 0; i < tensors.size(); i++) {
      Tensor t = tensors.get(i);
      Preconditions.checkArgument(Arrays.equals(shape, t.shape), "Cannot stack %s and %s.", Arrays.toString(shape), Arrays.toString(t.shape));
      System.arraycopy(t.data, 0, out, i * n, n);
      dtype = widest(dtype, t.dtype);
    }

    return new Tensor(newShape, out, dtype);
  }

  /**
   * Elementwise |this - other| <= atol + rtol * |other|, shapes must be equal.
   */
  public boolean allClose(Tensor other, double rtol, double atol) {
    if (!Arrays.equals(shape, other.shape)) {
      return false;
    }

    for (int i = 0; i < data.length; i++) {
      if (!(Math.abs(data[i] - other.data[i]) <= atol + rtol * Math.abs(other.data[i]))) {
        return false;
      }
    }

    return true;
  }

  public double maxAbsDifference(Tensor other) {
    Preconditions.checkArgument(Arrays.equals(shape, other.shape), "Shape mismatch, %s vs %s.", Arrays.toString(shape), Arrays.toString(other.shape));

    double max = 0.0D;

    for (int i = 0; i < data.length; i++) {
      max = Math.max(max, Math.abs(data[i] - other.data[i]));
    }

    return max;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Tensor)) {
      return false;
    }
    Tensor other = (Tensor) o;
    return dtype == other.dtype && Arrays.equals(shape, other.shape) && Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * dtype.hashCode() + Arrays.hashCode(shape)) + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Tensor(shape=");
    sb.append(Arrays.toString(shape));
    sb.append(", dtype=");
    sb.append(dtype);
    if (data.length <= 16) {
      sb.append(", data=");
      sb.append(Arrays.toString(data));
    }
    sb.append(")");
    return sb.toString();
  }

  private int axis(int axis) {
    int ax = axis < 0 ? axis + shape.length : axis;
    Preconditions.checkElementIndex(ax, shape.length, "axis");
    return ax;
  }

  private static DType widest(DType d1, DType d2) {
    return DType.FLOAT64 == d1 || DType.FLOAT64 == d2 ? DType.FLOAT64 : DType.FLOAT32;
  }

  private static int numel(int[] shape) {
    return numel(shape, 0, shape.length);
  }

  private static int numel(int[] shape, int from, int to) {
    int n = 1;
    for (int i = from; i < to; i++) {
      Preconditions.checkArgument(shape[i] >= 0, "Negative dimension in %s.", Arrays.toString(shape));
      n *= shape[i];
    }
    return n;
  }
}
