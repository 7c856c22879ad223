package com.flamingo.ai.specchunker.ingestion.extraction;

import com.flamingo.ai.specchunker.ingestion.model.BoundingBox;
import com.flamingo.ai.specchunker.ingestion.model.ImageRegion;
import java.awt.geom.Point2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.contentstream.PDFGraphicsStreamEngine;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImage;
import org.apache.pdfbox.util.Matrix;

/**
 * Records the vector paths and raster images painted on a page.
 *
 * <p>Every painted path contributes one drawing element (its bounds) and its straight segments
 * as rulings. Images are located by mapping the unit square through the current transformation
 * matrix. All coordinates are converted to the top-left origin of the crop box.
 */
final class PdfGraphicsCollector extends PDFGraphicsStreamEngine {

  /** Paths covering more of the page than this are backgrounds, not drawings. */
  private static final float MAX_ELEMENT_PAGE_SHARE = 0.9f;

  /** Rectangles thinner than this are drawn rules rather than boxes. */
  private static final float RULE_THICKNESS = 2.0f;

  private final float originX;
  private final float top;
  private final float pageArea;

  private final List<BoundingBox> drawingElements = new ArrayList<>();
  private final List<Ruling> rulings = new ArrayList<>();
  private final List<ImageRegion> images = new ArrayList<>();

  private final List<Ruling> pathSegments = new ArrayList<>();
  private BoundingBox pathBounds;
  private Point2D.Float currentPoint;
  private Point2D.Float subpathStart;

  PdfGraphicsCollector(PDPage page) {
    super(page);
    PDRectangle box = page.getCropBox();
    this.originX = box.getLowerLeftX();
    this.top = box.getUpperRightY();
    this.pageArea = box.getWidth() * box.getHeight();
  }

  void run() throws IOException {
    processPage(getPage());
  }

  List<BoundingBox> drawingElements() {
    return drawingElements;
  }

  List<Ruling> rulings() {
    return rulings;
  }

  List<ImageRegion> images() {
    return images;
  }

  @Override
  public void appendRectangle(Point2D p0, Point2D p1, Point2D p2, Point2D p3) {
    BoundingBox rect =
        new BoundingBox(
            (float) Math.min(Math.min(p0.getX(), p1.getX()), Math.min(p2.getX(), p3.getX())),
            (float) Math.min(Math.min(p0.getY(), p1.getY()), Math.min(p2.getY(), p3.getY())),
            (float) Math.max(Math.max(p0.getX(), p1.getX()), Math.max(p2.getX(), p3.getX())),
            (float) Math.max(Math.max(p0.getY(), p1.getY()), Math.max(p2.getY(), p3.getY())));
    extendPath(rect.x0(), rect.y0());
    extendPath(rect.x1(), rect.y1());
    if (rect.height() <= RULE_THICKNESS) {
      addSegment(rect.x0(), rect.centerY(), rect.x1(), rect.centerY());
    } else if (rect.width() <= RULE_THICKNESS) {
      addSegment(rect.centerX(), rect.y0(), rect.centerX(), rect.y1());
    } else {
      addSegment(rect.x0(), rect.y0(), rect.x1(), rect.y0());
      addSegment(rect.x0(), rect.y1(), rect.x1(), rect.y1());
      addSegment(rect.x0(), rect.y0(), rect.x0(), rect.y1());
      addSegment(rect.x1(), rect.y0(), rect.x1(), rect.y1());
    }
    currentPoint = new Point2D.Float((float) p0.getX(), (float) p0.getY());
    subpathStart = currentPoint;
  }

  @Override
  public void drawImage(PDImage pdImage) {
    Matrix ctm = getGraphicsState().getCurrentTransformationMatrix();
    Point2D.Float a = ctm.transformPoint(0, 0);
    Point2D.Float b = ctm.transformPoint(1, 0);
    Point2D.Float c = ctm.transformPoint(0, 1);
    Point2D.Float d = ctm.transformPoint(1, 1);
    float x0 = Math.min(Math.min(a.x, b.x), Math.min(c.x, d.x));
    float x1 = Math.max(Math.max(a.x, b.x), Math.max(c.x, d.x));
    float y0 = Math.min(Math.min(a.y, b.y), Math.min(c.y, d.y));
    float y1 = Math.max(Math.max(a.y, b.y), Math.max(c.y, d.y));
    images.add(
        new ImageRegion(
            new BoundingBox(toX(x0), toY(y1), toX(x1), toY(y0)),
            pdImage.getWidth(),
            pdImage.getHeight()));
  }

  @Override
  public void clip(int windingRule) {
    // clipping paths are never painted
  }

  @Override
  public void moveTo(float x, float y) {
    currentPoint = new Point2D.Float(x, y);
    subpathStart = currentPoint;
    extendPath(x, y);
  }

  @Override
  public void lineTo(float x, float y) {
    if (currentPoint != null) {
      addSegment(currentPoint.x, currentPoint.y, x, y);
    }
    currentPoint = new Point2D.Float(x, y);
    extendPath(x, y);
  }

  @Override
  public void curveTo(float x1, float y1, float x2, float y2, float x3, float y3) {
    extendPath(x1, y1);
    extendPath(x2, y2);
    extendPath(x3, y3);
    currentPoint = new Point2D.Float(x3, y3);
  }

  @Override
  public Point2D getCurrentPoint() {
    return currentPoint;
  }

  @Override
  public void closePath() {
    if (currentPoint != null && subpathStart != null) {
      addSegment(currentPoint.x, currentPoint.y, subpathStart.x, subpathStart.y);
      currentPoint = subpathStart;
    }
  }

  @Override
  public void endPath() {
    resetPath();
  }

  @Override
  public void strokePath() {
    paintPath();
  }

  @Override
  public void fillPath(int windingRule) {
    paintPath();
  }

  @Override
  public void fillAndStrokePath(int windingRule) {
    paintPath();
  }

  @Override
  public void shadingFill(COSName shadingName) {
    // shadings carry no geometry of their own
  }

  private void paintPath() {
    if (pathBounds != null && pathBounds.area() < pageArea * MAX_ELEMENT_PAGE_SHARE) {
      if (pathBounds.width() > 0 && pathBounds.height() > 0) {
        drawingElements.add(
            new BoundingBox(
                toX(pathBounds.x0()),
                toY(pathBounds.y1()),
                toX(pathBounds.x1()),
                toY(pathBounds.y0())));
      }
      for (Ruling segment : pathSegments) {
        rulings.add(
            new Ruling(
                toX(segment.x0()), toY(segment.y0()), toX(segment.x1()), toY(segment.y1())));
      }
    }
    resetPath();
  }

  private void resetPath() {
    pathBounds = null;
    pathSegments.clear();
    currentPoint = null;
    subpathStart = null;
  }

  private void extendPath(float x, float y) {
    BoundingBox point = new BoundingBox(x, y, x, y);
    pathBounds = pathBounds == null ? point : pathBounds.union(point);
  }

  private void addSegment(float x0, float y0, float x1, float y1) {
    pathSegments.add(new Ruling(x0, y0, x1, y1));
  }

  private float toX(float x) {
    return x - originX;
  }

  private float toY(float y) {
    return top - y;
  }
}
