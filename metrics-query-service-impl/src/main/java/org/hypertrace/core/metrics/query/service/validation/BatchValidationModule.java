package org.hypertrace.core.metrics.query.service.validation;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;

public class BatchValidationModule extends AbstractModule {
  @Override
  protected void configure() {
    Multibinder<BatchValidation> validationMultibinder =
        Multibinder.newSetBinder(binder(), BatchValidation.class);
    validationMultibinder.addBinding().to(ReferenceIdValidation.class);
    validationMultibinder.addBinding().to(ExpressionValidation.class);
    validationMultibinder.addBinding().to(TimeRangeValidation.class);
  }
}
