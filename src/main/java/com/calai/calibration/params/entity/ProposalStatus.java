package com.calai.calibration.params.entity;

public enum ProposalStatus { PENDING, APPROVED, REJECTED }
