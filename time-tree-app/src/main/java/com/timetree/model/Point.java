package com.timetree.model;

public record Point(double x, double y) {
}
