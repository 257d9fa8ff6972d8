package com.phillippitts.cabinassist.service.nlu;

import com.phillippitts.cabinassist.domain.NluResult;
import com.phillippitts.cabinassist.service.lifecycle.ManagedComponent;

/**
 * Intent classification and entity extraction collaborator.
 */
public interface LanguageUnderstanding extends ManagedComponent {

    NluResult process(String text);
}
