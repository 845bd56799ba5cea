package com.cargo.monitor.model;

import lombok.Value;

import java.util.List;

/**
 * Expected route envelope, expressed as a closed polygon of vertices.
 * The closing edge from the last vertex back to the first is implicit.
 */
@Value
public class RouteCorridor {

    List<GeoPoint> vertices;

    public RouteCorridor(List<GeoPoint> vertices) {
        if (vertices == null || vertices.size() < 3) {
            throw new IllegalArgumentException("A route corridor needs at least 3 vertices");
        }
        this.vertices = List.copyOf(vertices);
    }

    /**
     * Ray-casting containment test. Points on a vertex count as inside.
     */
    public boolean contains(GeoPoint point) {
        boolean inside = false;
        int n = vertices.size();
        for (int i = 0, j = n - 1; i < n; j = i++) {
            GeoPoint a = vertices.get(i);
            GeoPoint b = vertices.get(j);
            if (a.latitude() == point.latitude() && a.longitude() == point.longitude()) {
                return true;
            }
            boolean crosses = (a.latitude() > point.latitude()) != (b.latitude() > point.latitude());
            if (crosses) {
                double lonAtLat = (b.longitude() - a.longitude())
                        * (point.latitude() - a.latitude())
                        / (b.latitude() - a.latitude())
                        + a.longitude();
                if (point.longitude() < lonAtLat) {
                    inside = !inside;
                }
            }
        }
        return inside;
    }
}
