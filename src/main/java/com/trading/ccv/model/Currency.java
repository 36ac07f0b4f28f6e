package com.trading.ccv.model;

/**
 * Unit of settlement. A pure tag: conversion between currencies is the market
 * model's job.
 */
public enum Currency {
    USD, EUR, GBP, JPY
}
