package com.vidnyan.causeway.domain.validation;

import com.vidnyan.causeway.domain.trace.Trace;

public record TrainTestSplit(Trace train, Trace test) {}
