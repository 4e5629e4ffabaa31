package com.library.circulation.service;

import com.library.circulation.entity.Loan;
import com.library.circulation.entity.Reservation;

/** A queue head converted into a loan. */
public record Promotion(Reservation reservation, Loan loan) {}
