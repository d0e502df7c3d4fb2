package nl.bytesoflife.deltacnc.renderer.svg;

import nl.bytesoflife.deltacnc.model.geometry.ExpandedCircle;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedGeometry;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedPath;
import nl.bytesoflife.deltacnc.model.geometry.ExpandedPoint;
import nl.bytesoflife.deltacnc.model.operation.PathPoint;
import nl.bytesoflife.deltacnc.tube.VoidBounds;

import java.util.Locale;

/**
 * Renders expanded job geometry as a static SVG preview.
 *
 * <p>Coordinates are inches with Y up; the SVG is drawn with row 0 at the top, so
 * Y is flipped around the material height. Arc vertices of line cuts are joined
 * with straight segments.
 *
 * <pre>
 * String svg = new PreviewSvgRenderer()
 *     .setCutColor("#d33")
 *     .render(geometry, 6.0, 4.0, voidBounds);
 * </pre>
 */
public class PreviewSvgRenderer {

    public static final double PIXELS_PER_INCH = 50.0;
    public static final double PADDING = 40.0;
    public static final double LEGEND_HEIGHT = 28.0;

    private static final double DRILL_MARKER_RADIUS = 3.0;
    private static final double DRILL_HALO_RADIUS = 7.0;
    private static final double VERTEX_MARKER_RADIUS = 2.0;

    private String materialColor = "#f4efe6";
    private String outlineColor = "#555555";
    private String drillColor = "#1f6fd1";
    private String cutColor = "#d1361f";
    private String voidColor = "#888888";
    private String textColor = "#333333";

    public PreviewSvgRenderer setMaterialColor(String color) {
        this.materialColor = color;
        return this;
    }

    public PreviewSvgRenderer setOutlineColor(String color) {
        this.outlineColor = color;
        return this;
    }

    public PreviewSvgRenderer setDrillColor(String color) {
        this.drillColor = color;
        return this;
    }

    public PreviewSvgRenderer setCutColor(String color) {
        this.cutColor = color;
        return this;
    }

    public PreviewSvgRenderer setVoidColor(String color) {
        this.voidColor = color;
        return this;
    }

    public PreviewSvgRenderer setTextColor(String color) {
        this.textColor = color;
        return this;
    }

    public String render(ExpandedGeometry geometry, double materialWidth, double materialHeight) {
        return render(geometry, materialWidth, materialHeight, null);
    }

    /**
     * @param voidBounds the tube void to outline, or null when void skipping is off
     */
    public String render(ExpandedGeometry geometry, double materialWidth, double materialHeight,
                         VoidBounds voidBounds) {
        Frame frame = new Frame(materialWidth, materialHeight);
        StringBuilder svg = new StringBuilder();

        svg.append(String.format(Locale.US,
                "<svg xmlns=\"http://www.w3.org/2000/svg\" viewBox=\"0 0 %.1f %.1f\" "
                        + "width=\"%.1f\" height=\"%.1f\" font-family=\"sans-serif\">\n",
                frame.viewWidth(), frame.viewHeight(), frame.viewWidth(), frame.viewHeight()));

        // Material
        svg.append(String.format(Locale.US,
                "<rect class=\"material\" x=\"%.2f\" y=\"%.2f\" width=\"%.2f\" height=\"%.2f\" "
                        + "fill=\"%s\" stroke=\"%s\" stroke-width=\"1.5\"/>\n",
                frame.px(0), frame.py(materialHeight),
                materialWidth * PIXELS_PER_INCH, materialHeight * PIXELS_PER_INCH,
                materialColor, outlineColor));

        if (voidBounds != null) {
            svg.append(String.format(Locale.US,
                    "<rect class=\"tube-void\" x=\"%.2f\" y=\"%.2f\" width=\"%.2f\" height=\"%.2f\" "
                            + "fill=\"none\" stroke=\"%s\" stroke-width=\"1\" stroke-dasharray=\"6 4\"/>\n",
                    frame.px(voidBounds.xMin()), frame.py(voidBounds.yMax()),
                    voidBounds.width() * PIXELS_PER_INCH, voidBounds.height() * PIXELS_PER_INCH,
                    voidColor));
        }

        appendAxes(svg, frame);

        for (ExpandedCircle circle : geometry.circles()) {
            svg.append(String.format(Locale.US,
                    "<circle class=\"circle-cut\" cx=\"%.2f\" cy=\"%.2f\" r=\"%.2f\" "
                            + "fill=\"none\" stroke=\"%s\" stroke-width=\"1.5\"/>\n",
                    frame.px(circle.x()), frame.py(circle.y()),
                    circle.radius() * PIXELS_PER_INCH, cutColor));
        }

        for (ExpandedPath path : geometry.paths()) {
            appendPath(svg, frame, path);
        }

        for (ExpandedPoint p : geometry.drillPoints()) {
            svg.append(String.format(Locale.US,
                    "<circle class=\"drill-halo\" cx=\"%.2f\" cy=\"%.2f\" r=\"%.1f\" fill=\"%s\" fill-opacity=\"0.25\"/>\n",
                    frame.px(p.x()), frame.py(p.y()), DRILL_HALO_RADIUS, drillColor));
            svg.append(String.format(Locale.US,
                    "<circle class=\"drill\" cx=\"%.2f\" cy=\"%.2f\" r=\"%.1f\" fill=\"%s\"/>\n",
                    frame.px(p.x()), frame.py(p.y()), DRILL_MARKER_RADIUS, drillColor));
        }

        appendLegend(svg, frame, voidBounds != null);
        svg.append("</svg>");
        return svg.toString();
    }

    private void appendPath(StringBuilder svg, Frame frame, ExpandedPath path) {
        StringBuilder points = new StringBuilder();
        for (PathPoint p : path.points()) {
            if (points.length() > 0) points.append(' ');
            points.append(String.format(Locale.US, "%.2f,%.2f", frame.px(p.x()), frame.py(p.y())));
        }
        String element = path.closed() ? "polygon" : "polyline";
        svg.append(String.format(Locale.US,
                "<%s class=\"line-cut\" points=\"%s\" fill=\"none\" stroke=\"%s\" stroke-width=\"1.5\"/>\n",
                element, points, cutColor));
        for (PathPoint p : path.points()) {
            svg.append(String.format(Locale.US,
                    "<circle class=\"vertex\" cx=\"%.2f\" cy=\"%.2f\" r=\"%.1f\" fill=\"%s\"/>\n",
                    frame.px(p.x()), frame.py(p.y()), VERTEX_MARKER_RADIUS, cutColor));
        }
    }

    private void appendAxes(StringBuilder svg, Frame frame) {
        double bottom = frame.py(0);
        for (int i = 0; i <= (int) Math.floor(frame.width); i++) {
            double x = frame.px(i);
            svg.append(String.format(Locale.US,
                    "<line class=\"tick\" x1=\"%.2f\" y1=\"%.2f\" x2=\"%.2f\" y2=\"%.2f\" stroke=\"%s\"/>\n",
                    x, bottom, x, bottom + 5, textColor));
            svg.append(String.format(Locale.US,
                    "<text class=\"tick-label\" x=\"%.2f\" y=\"%.2f\" font-size=\"10\" text-anchor=\"middle\" fill=\"%s\">%d\"</text>\n",
                    x, bottom + 17, textColor, i));
        }
        double left = frame.px(0);
        for (int i = 0; i <= (int) Math.floor(frame.height); i++) {
            double y = frame.py(i);
            svg.append(String.format(Locale.US,
                    "<line class=\"tick\" x1=\"%.2f\" y1=\"%.2f\" x2=\"%.2f\" y2=\"%.2f\" stroke=\"%s\"/>\n",
                    left - 5, y, left, y, textColor));
            svg.append(String.format(Locale.US,
                    "<text class=\"tick-label\" x=\"%.2f\" y=\"%.2f\" font-size=\"10\" text-anchor=\"end\" fill=\"%s\">%d\"</text>\n",
                    left - 8, y + 3, textColor, i));
        }
    }

    private void appendLegend(StringBuilder svg, Frame frame, boolean showVoid) {
        double y = frame.viewHeight() - LEGEND_HEIGHT / 2;
        double x = PADDING;

        svg.append(String.format(Locale.US,
                "<g class=\"legend\" font-size=\"11\" fill=\"%s\">\n", textColor));
        svg.append(String.format(Locale.US,
                "<circle cx=\"%.2f\" cy=\"%.2f\" r=\"%.1f\" fill=\"%s\"/>\n", x, y, DRILL_MARKER_RADIUS, drillColor));
        svg.append(String.format(Locale.US,
                "<text x=\"%.2f\" y=\"%.2f\">Drill</text>\n", x + 8, y + 4));
        x += 60;
        svg.append(String.format(Locale.US,
                "<circle cx=\"%.2f\" cy=\"%.2f\" r=\"5\" fill=\"none\" stroke=\"%s\"/>\n", x, y, cutColor));
        svg.append(String.format(Locale.US,
                "<text x=\"%.2f\" y=\"%.2f\">Circle cut</text>\n", x + 10, y + 4));
        x += 90;
        svg.append(String.format(Locale.US,
                "<line x1=\"%.2f\" y1=\"%.2f\" x2=\"%.2f\" y2=\"%.2f\" stroke=\"%s\" stroke-width=\"1.5\"/>\n",
                x - 6, y, x + 6, y, cutColor));
        svg.append(String.format(Locale.US,
                "<text x=\"%.2f\" y=\"%.2f\">Line cut</text>\n", x + 10, y + 4));
        if (showVoid) {
            x += 80;
            svg.append(String.format(Locale.US,
                    "<line x1=\"%.2f\" y1=\"%.2f\" x2=\"%.2f\" y2=\"%.2f\" stroke=\"%s\" stroke-dasharray=\"4 2\"/>\n",
                    x - 6, y, x + 6, y, voidColor));
            svg.append(String.format(Locale.US,
                    "<text x=\"%.2f\" y=\"%.2f\">Tube void (skipped)</text>\n", x + 10, y + 4));
        }
        svg.append("</g>\n");
    }

    /**
     * Maps material inches to view pixels.
     */
    private record Frame(double width, double height) {

        double viewWidth() {
            return width * PIXELS_PER_INCH + 2 * PADDING;
        }

        double viewHeight() {
            return height * PIXELS_PER_INCH + 2 * PADDING + LEGEND_HEIGHT;
        }

        double px(double x) {
            return PADDING + x * PIXELS_PER_INCH;
        }

        double py(double y) {
            return PADDING + (height - y) * PIXELS_PER_INCH;
        }
    }
}
