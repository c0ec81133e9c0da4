package io.b2mash.roaf.projection;

import static io.b2mash.roaf.collection.RepeatingCollectionMapper.mapCollection;

import io.b2mash.roaf.collection.RepeatingEntryMappers;
import io.b2mash.roaf.config.ProjectionProperties;
import io.b2mash.roaf.document.CanonicalDocument;
import io.b2mash.roaf.exception.MissingPrimaryIdentifierException;
import io.b2mash.roaf.flag.ConditionFlag;
import io.b2mash.roaf.flag.FlagDeriver;
import io.b2mash.roaf.record.AuthorisedIndividualFields;
import io.b2mash.roaf.record.RawRecord;
import io.b2mash.roaf.section.DerivedFlagRules;
import io.b2mash.roaf.section.SectionComposer;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Projects one Authorised Individual record into its {@link CanonicalDocument}. Flags are derived
 * first; every section and collection is then built from the record plus those flags.
 *
 * <p>Only a missing primary identifier fails the projection. All other gaps degrade to empty
 * values, fallbacks or absent sections.
 */
@Service
public class AuthorisedIndividualProjector {

  private static final Logger log = LoggerFactory.getLogger(AuthorisedIndividualProjector.class);

  static final String ENTITY_NAME = "Authorised Individual";

  private final FlagDeriver flagDeriver;
  private final SectionComposer sectionComposer;
  private final RepeatingEntryMappers entryMappers;
  private final ProjectionProperties properties;
  private final Clock clock;

  public AuthorisedIndividualProjector(
      FlagDeriver flagDeriver,
      SectionComposer sectionComposer,
      RepeatingEntryMappers entryMappers,
      ProjectionProperties properties,
      Clock clock) {
    this.flagDeriver = flagDeriver;
    this.sectionComposer = sectionComposer;
    this.entryMappers = entryMappers;
    this.properties = properties;
    this.clock = clock;
  }

  public CanonicalDocument project(RawRecord record) {
    Objects.requireNonNull(record, "record");
    String id =
        record
            .primaryId(AuthorisedIndividualFields.ID)
            .orElseThrow(
                () ->
                    new MissingPrimaryIdentifierException(
                        ENTITY_NAME, AuthorisedIndividualFields.ID));

    log.info("Projecting {} {} ({} raw fields)", ENTITY_NAME, id, record.size());

    var flags = flagDeriver.deriveFlags(record);
    var derivedFlags = DerivedFlagRules.derive(flags, record);

    var document =
        new CanonicalDocument(
            sectionComposer.composeGuidelines(record),
            sectionComposer.composeDisclosure(record),
            sectionComposer.composeApplication(id, record, flags),
            flags,
            derivedFlags,
            sectionComposer.composeLicensedFunctions(record, derivedFlags),
            mapCollection(
                record, AuthorisedIndividualFields.PASSPORT_DETAILS, entryMappers::passportDetail),
            mapCollection(
                record, AuthorisedIndividualFields.CITIZENSHIPS, entryMappers::citizenship),
            flags.isSet(ConditionFlag.HAS_REGULATORY_HISTORY)
                ? mapCollection(
                    record,
                    AuthorisedIndividualFields.REGULATORY_HISTORY,
                    entryMappers::regulatoryHistory)
                : List.of(),
            sectionComposer.composePosition(record, flags),
            mapCollection(
                record, AuthorisedIndividualFields.CAREER_HISTORY, entryMappers::careerHistory),
            sectionComposer.composeCandidateProfile(record),
            mapCollection(
                record,
                AuthorisedIndividualFields.HIGHER_EDUCATION,
                entryMappers::higherEducation),
            mapCollection(
                record,
                AuthorisedIndividualFields.PROFESSIONAL_QUALIFICATIONS,
                entryMappers::qualification),
            mapCollection(
                record,
                AuthorisedIndividualFields.OTHER_QUALIFICATIONS,
                entryMappers::qualification),
            mapCollection(
                record,
                AuthorisedIndividualFields.PROFESSIONAL_MEMBERSHIPS,
                entryMappers::professionalMembership),
            sectionComposer.composeWorkExperience(record, flags),
            mapCollection(
                record, AuthorisedIndividualFields.OTHER_HOLDINGS, entryMappers::otherHolding),
            Instant.now(clock).toString(),
            properties.templateVersion());

    log.info(
        "Projected {} {}: licensedFunctions={}, previousAddress={}, otherNames={},"
            + " regulatoryHistory={}, careerHistory={}",
        ENTITY_NAME,
        id,
        document.licensedFunctions().isPresent(),
        document.application().previousAddress().isPresent(),
        document.application().otherNames().isPresent(),
        document.regulatoryHistory().size(),
        document.careerHistory().size());
    return document;
  }
}
