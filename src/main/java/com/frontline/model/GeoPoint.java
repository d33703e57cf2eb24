package com.frontline.model;

/**
 * A latitude/longitude pair. Also used for normalized push direction vectors.
 *
 * @param lat latitude, or the north component of a direction
 * @param lng longitude, or the east component of a direction
 */
public record GeoPoint(double lat, double lng) {}
