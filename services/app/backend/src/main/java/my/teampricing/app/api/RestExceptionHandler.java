package my.teampricing.app.api;

import jakarta.servlet.http.HttpServletRequest;
import my.teampricing.app.service.BreakdownNotFoundException;
import my.teampricing.app.service.InvalidPricingDataException;
import my.teampricing.app.service.PricingViewNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class RestExceptionHandler {
	private static final Logger logger = LoggerFactory.getLogger(RestExceptionHandler.class);

	@ExceptionHandler(IllegalArgumentException.class)
	public ProblemDetail handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
		logger.warn("Bad request on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request);
	}

	@ExceptionHandler(MissingServletRequestParameterException.class)
	public ProblemDetail handleMissingParameter(MissingServletRequestParameterException ex, HttpServletRequest request) {
		logger.warn("Missing parameter on {}: {}", request.getRequestURI(), ex.getParameterName());
		return problem(HttpStatus.BAD_REQUEST, "Bad Request", "Missing parameter: " + ex.getParameterName(), request);
	}

	@ExceptionHandler(PricingViewNotFoundException.class)
	public ProblemDetail handleViewNotFound(PricingViewNotFoundException ex, HttpServletRequest request) {
		logger.warn("Unknown pricing view {} on {}", ex.getViewId(), request.getRequestURI());
		return problem(HttpStatus.NOT_FOUND, "Pricing view not found", ex.getMessage(), request);
	}

	@ExceptionHandler(BreakdownNotFoundException.class)
	public ProblemDetail handleBreakdownNotFound(BreakdownNotFoundException ex, HttpServletRequest request) {
		return problem(HttpStatus.NOT_FOUND, "Breakdown not found", ex.getMessage(), request);
	}

	@ExceptionHandler(InvalidPricingDataException.class)
	public ProblemDetail handleInvalidData(InvalidPricingDataException ex, HttpServletRequest request) {
		logger.error("Stored pricing data is invalid on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Invalid pricing data", ex.getMessage(), request);
	}

	@ExceptionHandler(NoResourceFoundException.class)
	public ProblemDetail handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
		return problem(HttpStatus.NOT_FOUND, "Not Found", "Resource not found.", request);
	}

	@ExceptionHandler(Exception.class)
	public ProblemDetail handleUnhandled(Exception ex, HttpServletRequest request) {
		logger.error("Unexpected error on {}", request.getRequestURI(), ex);
		return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "Unexpected error", request);
	}

	private ProblemDetail problem(HttpStatus status, String title, String detail, HttpServletRequest request) {
		ProblemDetail problem = ProblemDetail.forStatus(status);
		problem.setTitle(title);
		problem.setDetail(detail);
		problem.setProperty("path", request.getRequestURI());
		return problem;
	}
}
