package com.kotsin.forecast.model;

import lombok.Value;

import java.util.List;

/**
 * TrainTestSplit - Training prefix and test suffix of an ordered list.
 *
 * Every training timestamp precedes every test timestamp.
 */
@Value
public class TrainTestSplit<T extends Timestamped> {

    List<T> train;
    List<T> test;
    SplitPolicy policy;

    public TrainTestSplit(List<T> train, List<T> test, SplitPolicy policy) {
        this.train = List.copyOf(train);
        this.test = List.copyOf(test);
        this.policy = policy;
    }

    public int trainSize() {
        return train.size();
    }

    public int testSize() {
        return test.size();
    }
}
