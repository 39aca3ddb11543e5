package com.example.sample;

public interface Shape {
    double area();
}
