package miselect;

import miselect.MIException.DimensionException;

/**
 * M completed copies of the same dataset, as produced by an external multiple
 * imputation procedure. All copies share the row count n and column count p.
 *
 * The arrays are the caller's; they are only read.
 */
public final class ImputedDataset {
  final double [][][] _x;   // [imputation][row][column]
  final double [][]   _y;   // [imputation][row]
  final int _nobs;
  final int _ncols;

  public ImputedDataset(double [][][] x, double [][] y){
    if(x == null || y == null)throw new DimensionException("missing designs or responses");
    if(x.length == 0)throw new DimensionException("no imputations given");
    if(x.length != y.length)
      throw new DimensionException("got " + x.length + " designs but " + y.length + " responses");
    if(x[0] == null)throw new DimensionException("imputation 0 is missing");
    _nobs = x[0].length;
    if(_nobs == 0)throw new DimensionException("imputation 0 has no rows");
    if(x[0][0] == null)throw new DimensionException("imputation 0 row 0 is missing");
    _ncols = x[0][0].length;
    if(_ncols == 0)throw new DimensionException("imputation 0 has no columns");
    for(int m = 0; m < x.length; ++m){
      if(x[m] == null)throw new DimensionException("imputation " + m + " is missing");
      if(x[m].length != _nobs)
        throw new DimensionException("imputation " + m + " has " + x[m].length + " rows, expected " + _nobs);
      if(y[m] == null || y[m].length != _nobs)
        throw new DimensionException("response " + m + " has length " + (y[m] == null?0:y[m].length) + ", expected " + _nobs);
      for(int i = 0; i < _nobs; ++i){
        if(x[m][i] == null || x[m][i].length != _ncols)
          throw new DimensionException("imputation " + m + " row " + i + " has " + (x[m][i] == null?0:x[m][i].length) + " columns, expected " + _ncols);
        for(int j = 0; j < _ncols; ++j)
          if(Double.isNaN(x[m][i][j]) || Double.isInfinite(x[m][i][j]))
            throw new MIException.InvalidParameterException("imputation " + m + " has non-finite value at row " + i + ", column " + j);
      }
    }
    _x = x;
    _y = y;
  }

  public int nimp() {return _x.length;}
  public int nobs() {return _nobs;}
  public int ncols(){return _ncols;}
  public double [][] x(int m){return _x[m];}
  public double []   y(int m){return _y[m];}

  public void checkResponse(Family f){
    for(double [] ym:_y)
      for(double v:ym)
        f.checkResponse(v);
  }

  /**
   * Rows flagged in {@code keep}, taken from every imputation so each copy keeps
   * the same original observations.
   */
  public ImputedDataset subset(boolean [] keep){
    if(keep.length != _nobs)throw new DimensionException("row mask has length " + keep.length + ", expected " + _nobs);
    int n = 0;
    for(boolean b:keep)if(b)++n;
    double [][][] x = new double[_x.length][n][];
    double [][]   y = new double[_x.length][n];
    for(int m = 0; m < _x.length; ++m){
      int r = 0;
      for(int i = 0; i < _nobs; ++i){
        if(!keep[i])continue;
        x[m][r] = _x[m][i];
        y[m][r] = _y[m][i];
        ++r;
      }
    }
    return new ImputedDataset(x, y);
  }

  /** One-imputation view of copy {@code m}. */
  public ImputedDataset imputation(int m){
    return new ImputedDataset(new double[][][]{_x[m]}, new double[][]{_y[m]});
  }
}
