package io.github.yok.ciflink.validation;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.transform.stream.StreamSource;
import javax.xml.validation.Schema;
import javax.xml.validation.SchemaFactory;
import javax.xml.validation.Validator;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Validates an XML document against an XSD file.
 *
 * <p>
 * Every error and fatal error reported by the validator becomes one violation with its line
 * number. Warnings are ignored.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class XmlSchemaValidationGate implements ValidationGate<String, File> {

    @Override
    public ValidationResult validate(String document, File schema) {
        List<String> errors = new ArrayList<>();
        try {
            SchemaFactory factory = SchemaFactory.newInstance(XMLConstants.W3C_XML_SCHEMA_NS_URI);
            Schema xsd = factory.newSchema(schema);
            Validator validator = xsd.newValidator();
            validator.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException e) {
                    // not a violation
                }

                @Override
                public void error(SAXParseException e) {
                    errors.add(describe(e));
                }

                @Override
                public void fatalError(SAXParseException e) throws SAXException {
                    errors.add(describe(e));
                    throw e;
                }
            });
            validator.validate(new StreamSource(new StringReader(document)));
        } catch (SAXParseException e) {
            if (errors.isEmpty()) {
                errors.add(describe(e));
            }
        } catch (SAXException e) {
            errors.add("Invalid schema " + schema + ": " + e.getMessage());
        } catch (IOException e) {
            errors.add("Cannot read schema " + schema + ": " + e.getMessage());
        }
        return ValidationResult.of(errors);
    }

    private static String describe(SAXParseException e) {
        return "line " + e.getLineNumber() + ": " + e.getMessage();
    }
}
